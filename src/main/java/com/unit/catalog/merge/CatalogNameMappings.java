package com.unit.catalog.merge;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Display names used by the external catalog, mapped to the local era and faction slugs.
 */
public final class CatalogNameMappings {

    private static final Map<String, String> ERAS = Map.ofEntries(
            Map.entry("Age of War", "age-of-war"),
            Map.entry("Star League", "star-league"),
            Map.entry("Early Succession War", "early-succession-wars"),
            Map.entry("Early Succession Wars", "early-succession-wars"),
            Map.entry("Late Succession War - LosTech", "late-succession-wars"),
            Map.entry("Late Succession War - Renaissance", "renaissance"),
            Map.entry("Clan Invasion", "clan-invasion"),
            Map.entry("Civil War", "civil-war"),
            Map.entry("Jihad", "jihad"),
            Map.entry("Dark Age", "dark-age"),
            Map.entry("Early Republic", "dark-age"),
            Map.entry("Late Republic", "dark-age"),
            Map.entry("ilClan", "ilclan"));

    private static final Map<String, String> FACTIONS = Map.ofEntries(
            // Great Houses
            Map.entry("Lyran Commonwealth", "steiner"),
            Map.entry("Lyran Alliance", "steiner"),
            Map.entry("Federated Suns", "davion"),
            Map.entry("Federated Commonwealth", "davion"),
            Map.entry("Draconis Combine", "kurita"),
            Map.entry("Free Worlds League", "marik"),
            Map.entry("Capellan Confederation", "liao"),
            Map.entry("Star League Regular", "star-league"),
            Map.entry("Star League Royal", "star-league"),
            Map.entry("Star League", "star-league"),
            Map.entry("ComStar", "comstar"),
            Map.entry("Word of Blake", "word-of-blake"),
            Map.entry("Republic of the Sphere", "republic"),
            // Clans
            Map.entry("Clan Wolf", "clan-wolf"),
            Map.entry("Clan Wolf (in Exile)", "clan-wolf"),
            Map.entry("Clan Jade Falcon", "clan-jade-falcon"),
            Map.entry("Clan Ghost Bear", "clan-ghost-bear"),
            Map.entry("Rasalhague Dominion", "clan-ghost-bear"),
            Map.entry("Clan Smoke Jaguar", "clan-smoke-jaguar"),
            Map.entry("Clan Nova Cat", "clan-nova-cat"),
            Map.entry("Clan Steel Viper", "clan-steel-viper"),
            Map.entry("Clan Diamond Shark", "clan-diamond-shark"),
            Map.entry("Clan Sea Fox", "clan-diamond-shark"),
            Map.entry("Clan Goliath Scorpion", "clan-goliath-scorpion"),
            Map.entry("Clan Ice Hellion", "clan-ice-hellion"),
            Map.entry("Clan Star Adder", "clan-star-adder"),
            Map.entry("Clan Hell's Horses", "clan-hell-horses"),
            Map.entry("Clan Blood Spirit", "clan-blood-spirit"),
            Map.entry("Clan Coyote", "clan-coyote"),
            Map.entry("Clan Fire Mandrill", "clan-fire-mandrill"),
            Map.entry("Clan Mongoose", "clan-mongoose"),
            Map.entry("Clan Widowmaker", "clan-widowmaker"),
            Map.entry("Clan Wolverine", "clan-wolverine"),
            // Periphery
            Map.entry("Taurian Concordat", "taurian-concordat"),
            Map.entry("Magistracy of Canopus", "magistracy-canopus"),
            Map.entry("Outworlds Alliance", "outworlds-alliance"),
            Map.entry("Marian Hegemony", "marian-hegemony"),
            // General
            Map.entry("Inner Sphere General", "general"),
            Map.entry("Clan General", "general"),
            Map.entry("Mercenary", "mercenary"));

    private CatalogNameMappings() {
    }

    public static Optional<String> eraSlug(String displayName) {
        return Optional.ofNullable(ERAS.get(displayName.trim()));
    }

    public static Optional<String> factionSlug(String displayName) {
        return Optional.ofNullable(FACTIONS.get(displayName.trim()));
    }

    /**
     * Faction type for a faction first seen in external data.
     */
    public static String inferFactionType(String name) {
        if (name.startsWith("Clan ")) {
            return "clan";
        }
        if (name.contains("Periphery") || name.contains("Concordat") || name.contains("Canopus")
                || name.contains("Alliance") || name.contains("Hegemony") || name.contains("Magistracy")) {
            return "periphery";
        }
        if (name.toLowerCase(Locale.ROOT).contains("mercenary")) {
            return "mercenary";
        }
        return "other";
    }
}
