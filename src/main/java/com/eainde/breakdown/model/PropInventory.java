package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Items of one scene, split by department. No label appears in more than one list.
 *
 * @param props       portable items handled by the cast
 * @param setDressing fixed furniture and decor
 * @param vehicles    anything driven or ridden
 */
public record PropInventory(
        @JsonProperty("props")        List<String> props,
        @JsonProperty("set_dressing") List<String> setDressing,
        @JsonProperty("vehicles")     List<String> vehicles
) implements Serializable {

    public PropInventory {
        props = props == null ? List.of() : List.copyOf(props);
        setDressing = setDressing == null ? List.of() : List.copyOf(setDressing);
        vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
    }

    public static PropInventory empty() {
        return new PropInventory(List.of(), List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return every item in the order props, set dressing, vehicles
     */
    @JsonIgnore
    public List<String> allItems() {
        List<String> all = new ArrayList<>(props.size() + setDressing.size() + vehicles.size());
        all.addAll(props);
        all.addAll(setDressing);
        all.addAll(vehicles);
        return all;
    }

    public List<String> items(PropCategory category) {
        switch (category) {
            case PROPS:
                return props;
            case SET_DRESSING:
                return setDressing;
            case VEHICLES:
                return vehicles;
            default:
                throw new IllegalArgumentException("Unknown category: " + category);
        }
    }

    /**
     * Accumulates items and refuses any label that is already filed, whatever its category.
     */
    public static final class Builder {

        private final List<String> props = new ArrayList<>();
        private final List<String> setDressing = new ArrayList<>();
        private final List<String> vehicles = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        private Builder() {
        }

        /**
         * @return false if the label was already filed in any category
         */
        public boolean add(PropCategory category, String label) {
            if (label == null || label.isBlank()) return false;
            String key = label.strip().toLowerCase(Locale.ROOT);
            if (!seen.add(key)) return false;
            switch (category) {
                case PROPS:
                    props.add(label.strip());
                    break;
                case SET_DRESSING:
                    setDressing.add(label.strip());
                    break;
                case VEHICLES:
                    vehicles.add(label.strip());
                    break;
                default:
                    throw new IllegalArgumentException("Unknown category: " + category);
            }
            return true;
        }

        public PropInventory build() {
            return new PropInventory(props, setDressing, vehicles);
        }
    }
}
