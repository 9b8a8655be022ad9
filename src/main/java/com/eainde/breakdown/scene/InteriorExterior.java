package com.eainde.breakdown.scene;

public enum InteriorExterior {
    INT,
    EXT
}
