package com.casepilot.core.critic;

public class CriticVerdict {

    public static final String UNAVAILABLE_NOTE = "Critic review unavailable.";

    private final boolean agrees;
    private final String notes;
    private final String model;

    public CriticVerdict(boolean agrees, String notes, String model) {
        this.agrees = agrees;
        this.notes = notes != null ? notes : "";
        this.model = model;
    }

    /** Used whenever the review itself cannot be obtained; never blocks the investigation. */
    public static CriticVerdict unavailable(String model) {
        return new CriticVerdict(true, UNAVAILABLE_NOTE, model);
    }

    public boolean isAgrees() {
        return agrees;
    }

    public String getNotes() {
        return notes;
    }

    public String getModel() {
        return model;
    }

    @Override
    public String toString() {
        return "CriticVerdict{agrees=" + agrees + ", notes='" + notes + "', model=" + model + "}";
    }
}
