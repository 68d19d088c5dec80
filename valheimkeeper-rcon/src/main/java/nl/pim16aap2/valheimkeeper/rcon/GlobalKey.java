package nl.pim16aap2.valheimkeeper.rcon;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Boss progression keys used with {@code setkey} and {@code removekey}.
 */
@Accessors(fluent = true)
public enum GlobalKey
{
    DEFEATED_EIKTHYR("defeated_eikthyr"),
    DEFEATED_GDKING("defeated_gdking"),
    DEFEATED_BONEMASS("defeated_bonemass"),
    DEFEATED_DRAGON("defeated_dragon"),
    DEFEATED_GOBLINKING("defeated_goblinking"),
    DEFEATED_QUEEN("defeated_queen"),
    ;

    @Getter
    private final String key;

    GlobalKey(String key)
    {
        this.key = key;
    }
}
