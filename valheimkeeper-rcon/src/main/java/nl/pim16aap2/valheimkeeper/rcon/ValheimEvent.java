package nl.pim16aap2.valheimkeeper.rcon;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Random events that can be triggered with {@code randomevent}.
 */
@Accessors(fluent = true)
public enum ValheimEvent
{
    ARMY_EIKTHYR("army_eikthyr"),
    ARMY_THEELDER("army_theelder"),
    ARMY_BONEMASS("army_bonemass"),
    ARMY_MODER("army_moder"),
    ARMY_GOBLIN("army_goblin"),
    FORESTTROLLS("foresttrolls"),
    SKELETONS("skeletons"),
    BLOBS("blobs"),
    WOLVES("wolves"),
    BATS("bats"),
    SERPENTS("serpents"),
    ;

    @Getter
    private final String key;

    ValheimEvent(String key)
    {
        this.key = key;
    }
}
