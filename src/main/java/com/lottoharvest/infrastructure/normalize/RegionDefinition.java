package com.lottoharvest.infrastructure.normalize;

import java.util.List;

/**
 * A region code and the spellings that name it in addresses.
 */
public record RegionDefinition(String code, List<String> aliases) {

    public RegionDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
