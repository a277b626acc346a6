package com.lexassist.planner.model;

/**
 * Answer shapes a user can ask for. The label is what travels in the intent slots.
 */
public enum DesiredOutput {
    THESIS("теза"),
    CHECKLIST("чеклист"),
    TABLE("таблиця"),
    COLLECTION("підбірка"),
    COMPARISON("порівняння");

    private final String label;

    DesiredOutput(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
