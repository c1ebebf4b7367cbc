package com.finplan.plananalysis.model;

/**
 * How a sheet appears to be used.
 */
public enum SheetType {

    /** Maintained budget with live formulas. */
    LIVING_PLAN,

    /** Static values, typically an export or a pasted statement. */
    DATA_DUMP
}
