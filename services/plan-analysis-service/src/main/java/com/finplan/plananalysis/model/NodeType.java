package com.finplan.plananalysis.model;

/**
 * Structural role of a spreadsheet row in the analysis tree.
 */
public enum NodeType {

    /** Category header owning child items. */
    GROUP,

    /** Budget line with a value and a semantic tag. */
    ITEM,

    /** Row excluded from the tree. */
    IGNORE
}
