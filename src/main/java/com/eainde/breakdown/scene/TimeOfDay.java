package com.eainde.breakdown.scene;

public enum TimeOfDay {
    DAY,
    NIGHT
}
