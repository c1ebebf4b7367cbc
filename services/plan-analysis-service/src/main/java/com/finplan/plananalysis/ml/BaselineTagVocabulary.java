package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in multilingual keyword vocabulary (PT, EN, DE, FR, ES, RU) used when no
 * learned layer knows a term.
 *
 * <p>Each keyword contained in the term scores 1, an exact match scores 2 more. The
 * highest score wins; ties go to the tag declared first in {@link ItemTag}.
 */
public final class BaselineTagVocabulary {

    private final Map<ItemTag, Set<String>> keywords;

    private BaselineTagVocabulary(Map<ItemTag, Set<String>> keywords) {
        this.keywords = keywords;
    }

    public static BaselineTagVocabulary defaults() {
        Map<ItemTag, Set<String>> keywords = new EnumMap<>(ItemTag.class);
        keywords.put(ItemTag.BUDGET, keywords(
            // PT
            "alimentação", "supermercado", "mercado", "compras", "comida",
            "transporte", "combustível", "gasolina", "uber", "táxi",
            "restaurante", "café", "lazer", "entretenimento", "diversão",
            "roupas", "vestuário", "beleza", "saúde", "farmácia",
            "educação", "livros", "cursos", "presentes", "viagem",
            "manutenção", "casa", "carro", "habitação", "despesas",
            "variáveis", "variavel",
            // EN
            "groceries", "food", "dining", "restaurant", "coffee",
            "transportation", "fuel", "taxi", "parking",
            "entertainment", "movies", "shopping", "clothes", "clothing",
            "health", "pharmacy", "beauty", "haircut", "education",
            "books", "gifts", "travel", "vacation", "maintenance",
            "home", "car", "pet", "pets", "budget", "expenses",
            "dinner", "lunch", "fun",
            // DE
            "lebensmittel", "essen", "transport", "benzin",
            "kleidung", "gesundheit", "apotheke", "bildung", "reise",
            "spaß", "unterhaltung",
            // FR
            "alimentation", "nourriture", "essence",
            "vêtements", "santé", "pharmacie", "éducation", "voyage",
            "courses", "loisirs",
            // ES
            "alimentación", "ropa", "salud", "farmacia", "educación", "viaje", "ocio",
            // RU
            "продукты", "еда", "ресторан", "транспорт", "бензин",
            "одежда", "здоровье", "аптека", "образование", "путешествие",
            "развлечения", "покупки"));
        keywords.put(ItemTag.RECURRING, keywords(
            // PT
            "aluguel", "renda", "aluguer", "hipoteca", "prestação",
            "água", "luz", "gás", "eletricidade", "internet", "telefone",
            "seguro", "seguros", "assinatura", "assinaturas", "mensalidade",
            "netflix", "spotify", "hbo", "disney", "amazon prime",
            "condomínio", "iptu", "ipva", "fixos", "fixas",
            // EN
            "rent", "mortgage", "insurance", "subscription", "subscriptions",
            "utilities", "electricity", "water", "gas", "phone",
            "hulu", "gym", "membership", "recurring",
            // DE
            "miete", "versicherung", "strom", "wasser", "heizung",
            "abonnement", "mitgliedschaft",
            // FR
            "loyer", "assurance", "électricité", "eau", "chauffage",
            // ES
            "alquiler", "suscripción", "electricidad",
            // RU
            "аренда", "ипотека", "страховка", "подписка", "коммунальные",
            "электричество", "вода", "газ", "интернет", "телефон", "членство"));
        keywords.put(ItemTag.SAVINGS, keywords(
            // PT
            "poupança", "investimento", "investimentos", "reserva",
            "emergência", "fundo de emergência", "meta", "metas",
            "aposentadoria", "previdência", "ações", "fundos",
            "cripto", "bitcoin", "tesouro", "cdb", "lci", "lca",
            "boleto pessoal",
            // EN
            "savings", "investment", "investments", "emergency fund",
            "retirement", "401k", "ira", "stocks", "bonds", "etf",
            "crypto", "goal", "goals", "fund", "emergency",
            // DE
            "sparen", "investition", "notfall", "rente", "aktien",
            // FR
            "épargne", "investissement", "retraite", "actions",
            // ES
            "ahorro", "inversión", "jubilación", "acciones",
            // RU
            "сбережения", "инвестиции", "накопления", "акции",
            "криптовалюта", "биткоин", "пенсия", "резерв"));
        keywords.put(ItemTag.INCOME, keywords(
            // PT
            "salário", "renda", "receita", "rendimento", "rendimentos",
            "freelance", "bônus", "décimo terceiro", "férias",
            "dividendos", "aluguel recebido", "extra", "receitas",
            "renda total", "total receitas",
            // EN
            "salary", "income", "wages", "paycheck", "revenue",
            "bonus", "dividends", "rental income", "side hustle",
            // DE
            "gehalt", "einkommen", "lohn",
            // FR
            "salaire", "revenu", "revenus",
            // ES
            "salario", "ingreso", "ingresos", "sueldo",
            // RU
            "зарплата", "доход", "заработок", "оклад",
            "дивиденды", "премия", "фриланс"));
        keywords.put(ItemTag.DEBT, keywords(
            // PT
            "dívida", "dívidas", "empréstimo", "financiamento",
            "cartão de crédito", "parcelamento", "juros",
            // EN
            "debt", "loan", "credit card", "mortgage payment",
            "student loan", "car payment", "interest",
            // DE
            "schulden", "kredit", "darlehen",
            // FR
            "dette", "prêt", "crédit",
            // ES
            "deuda", "préstamo",
            // RU
            "долг", "кредит", "займ", "ипотечный платёж"));
        return new BaselineTagVocabulary(Collections.unmodifiableMap(keywords));
    }

    /**
     * Scores a normalized term against every tag's keywords.
     */
    public TagPrediction score(String normalizedTerm) {
        if (normalizedTerm.isEmpty()) {
            return TagPrediction.unknown();
        }

        ItemTag best = null;
        double bestScore = 0;
        double total = 0;
        for (Map.Entry<ItemTag, Set<String>> entry : keywords.entrySet()) {
            double score = 0;
            for (String keyword : entry.getValue()) {
                if (normalizedTerm.contains(keyword)) {
                    score += 1;
                    if (normalizedTerm.equals(keyword)) {
                        score += 2;
                    }
                }
            }
            total += score;
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }

        if (best == null) {
            return TagPrediction.unknown();
        }
        double absolute = bestScore >= 3 ? 0.95 : bestScore >= 2 ? 0.85 : 0.70;
        return new TagPrediction(best, (bestScore / total + absolute) / 2.0, PredictionSource.BASELINE);
    }

    private static Set<String> keywords(String... words) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(words)));
    }
}
