package com.quakesentinel.core.model;

public record TsunamiArea(TsunamiGrade grade, String nameRaw) {
    public TsunamiArea {
        grade = grade == null ? TsunamiGrade.UNKNOWN : grade;
        nameRaw = nameRaw == null ? "" : nameRaw;
    }
}
