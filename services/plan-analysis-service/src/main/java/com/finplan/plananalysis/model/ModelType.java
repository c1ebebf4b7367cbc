package com.finplan.plananalysis.model;

/**
 * Which learned model a correction belongs to.
 */
public enum ModelType {

    /** Category-name to tag prediction. */
    TEXT
}
