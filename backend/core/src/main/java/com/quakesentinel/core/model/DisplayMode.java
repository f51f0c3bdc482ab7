package com.quakesentinel.core.model;

public enum DisplayMode {
    SEISMIC,
    TSUNAMI,
    EEW;

    /**
     * Next mode in the Seismic/Tsunami rotation. EEW is never part of the rotation.
     */
    public DisplayMode rotated() {
        return this == SEISMIC ? TSUNAMI : SEISMIC;
    }
}
