package com.eainde.breakdown.scene;

import com.eainde.breakdown.pattern.TermSet;

/**
 * Coarse location category derived from the location text by keyword.
 * Checked in declaration order; the first hit wins.
 */
public enum LocationType {
    HOME(TermSet.of("home", "house", "apartments?", "flat", "منزل", "بيت", "شقة")),
    ROOM(TermSet.of("room", "bedroom", "غرفة")),
    OFFICE(TermSet.of("offices?", "مكتب")),
    PRECINCT(TermSet.of("precinct", "police", "headquarters", "مباحث", "قسم شرطة")),
    STATION(TermSet.of("station", "محطة")),
    VILLA(TermSet.of("villa", "mansion", "فيلا")),
    HOSPITAL(TermSet.of("hospital", "clinic", "ward", "مستشفى", "عيادة")),
    CAR(TermSet.of("cars?", "taxi", "سيارة")),
    STREET(TermSet.of("street", "road", "alley", "highway", "شارع", "طريق")),
    UNSPECIFIED(null);

    private final TermSet keywords;

    LocationType(TermSet keywords) {
        this.keywords = keywords;
    }

    public static LocationType classify(String location) {
        if (location == null || location.isBlank()) return UNSPECIFIED;
        for (LocationType type : values()) {
            if (type.keywords != null && type.keywords.foundIn(location)) {
                return type;
            }
        }
        return UNSPECIFIED;
    }
}
