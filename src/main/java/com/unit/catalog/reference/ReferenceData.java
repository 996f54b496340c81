package com.unit.catalog.reference;

import java.util.List;
import java.util.Optional;

/**
 * The fixed eras and factions seeded before any unit import.
 */
public final class ReferenceData {

    public static final List<Era> ERAS = List.of(
            new Era("age-of-war", "Age of War", 2398, 2570,
                    "The period of interstellar warfare that preceded the Star League."),
            new Era("star-league", "Star League", 2571, 2780,
                    "The golden age of humanity spanning the Star League era."),
            new Era("early-succession-wars", "Early Succession Wars", 2781, 2900,
                    "The First and Second Succession Wars; rapid technological decline."),
            new Era("late-succession-wars", "Late Succession Wars (LosTech)", 2901, 3019,
                    "Era of LosTech; Third and early Fourth Succession Wars."),
            new Era("renaissance", "Renaissance", 3020, 3049,
                    "Technological renaissance; Helm Memory Core; Fourth Succession War."),
            new Era("clan-invasion", "Clan Invasion", 3050, 3061,
                    "Clan forces attack the Inner Sphere; Operation Revival."),
            new Era("civil-war", "Civil War", 3062, 3067,
                    "FedCom Civil War; growing tensions across the Inner Sphere."),
            new Era("jihad", "Jihad", 3068, 3080,
                    "Word of Blake Jihad; widespread destruction across known space."),
            new Era("dark-age", "Dark Age", 3081, 3150,
                    "The Republic era and the collapse of HPG communications."),
            new Era("ilclan", "ilClan", 3151, null,
                    "Recognition of a new ilClan; reshaping of the Inner Sphere.")
    );

    public static final List<Faction> FACTIONS = List.of(
            new Faction("steiner", "Lyran Commonwealth", "LC", "great_house", false),
            new Faction("davion", "Federated Suns", "FS", "great_house", false),
            new Faction("kurita", "Draconis Combine", "DC", "great_house", false),
            new Faction("marik", "Free Worlds League", "FWL", "great_house", false),
            new Faction("liao", "Capellan Confederation", "CC", "great_house", false),
            new Faction("star-league", "Star League", "SL", "star_league", false),
            new Faction("comstar", "ComStar", "CS", "independent", false),
            new Faction("word-of-blake", "Word of Blake", "WoB", "independent", false),
            new Faction("republic", "Republic of the Sphere", "RS", "inner_sphere", false),
            new Faction("clan-wolf", "Clan Wolf", "CW", "clan", true),
            new Faction("clan-jade-falcon", "Clan Jade Falcon", "CJF", "clan", true),
            new Faction("clan-ghost-bear", "Clan Ghost Bear", "CGB", "clan", true),
            new Faction("clan-smoke-jaguar", "Clan Smoke Jaguar", "CSJ", "clan", true),
            new Faction("clan-nova-cat", "Clan Nova Cat", "CNC", "clan", true),
            new Faction("clan-steel-viper", "Clan Steel Viper", "CSV", "clan", true),
            new Faction("clan-diamond-shark", "Clan Diamond Shark", "CDS", "clan", true),
            new Faction("clan-goliath-scorpion", "Clan Goliath Scorpion", "CGS", "clan", true),
            new Faction("clan-ice-hellion", "Clan Ice Hellion", "CIH", "clan", true),
            new Faction("clan-star-adder", "Clan Star Adder", "CSA", "clan", true),
            new Faction("clan-hell-horses", "Clan Hell's Horses", "CHH", "clan", true),
            new Faction("clan-blood-spirit", "Clan Blood Spirit", "CBS", "clan", true),
            new Faction("clan-coyote", "Clan Coyote", "CCY", "clan", true),
            new Faction("clan-fire-mandrill", "Clan Fire Mandrill", "CFM", "clan", true),
            new Faction("clan-mongoose", "Clan Mongoose", "CMG", "clan", true),
            new Faction("clan-widowmaker", "Clan Widowmaker", "CWM", "clan", true),
            new Faction("clan-wolverine", "Clan Wolverine", "CWOV", "clan", true),
            new Faction("periphery-general", "Periphery (General)", "PER", "periphery", false),
            new Faction("taurian-concordat", "Taurian Concordat", "TC", "periphery", false),
            new Faction("magistracy-canopus", "Magistracy of Canopus", "MOC", "periphery", false),
            new Faction("outworlds-alliance", "Outworlds Alliance", "OA", "periphery", false),
            new Faction("marian-hegemony", "Marian Hegemony", "MH", "periphery", false),
            new Faction("mercenary", "Mercenary", "MER", "mercenary", false),
            new Faction("general", "General (All)", "GEN", "general", false)
    );

    private ReferenceData() {
    }

    public static Optional<Era> eraForYear(int year) {
        return ERAS.stream().filter(e -> e.contains(year)).findFirst();
    }
}
