package com.unit.catalog.equipment;

import com.unit.catalog.core.model.EquipmentCategory;
import com.unit.catalog.core.model.TechBase;
import com.unit.catalog.store.CatalogSession;
import com.unit.catalog.store.CatalogStore;
import com.unit.catalog.store.EquipmentRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Points each ammunition entry at the weapon that fires it.
 *
 * <p>The weapon key of an entry is its lowercased alphanumeric name with tech-base
 * prefixes and ammunition words removed, so {@code "IS Ammo AC/10"} and {@code "AC/10"}
 * both reduce to {@code ac10}. A link is written only when exactly one weapon of the
 * same tech base shares the ammunition's key; ambiguous or missing parents are left
 * unlinked and listed in the result.</p>
 */
public class AmmoLinker {
    private static final Logger log = LoggerFactory.getLogger(AmmoLinker.class);

    private static final String[] PREFIXES = {"clan", "is", "cl"};
    private static final String[] AMMO_WORDS = {"ammo", "ammunition", "full", "half"};

    private final CatalogStore store;

    public AmmoLinker(CatalogStore store) {
        this.store = store;
    }

    public Result link() {
        return store.inTransaction(this::link);
    }

    Result link(CatalogSession session) {
        List<EquipmentRow> equipment = session.listEquipment();
        Map<String, List<EquipmentRow>> weaponsByKey = new HashMap<>();
        for (EquipmentRow row : equipment) {
            if (row.category().isWeapon()) {
                weaponsByKey.computeIfAbsent(weaponKey(row.name()), k -> new ArrayList<>()).add(row);
            }
        }

        int linked = 0;
        int alreadyLinked = 0;
        List<String> ambiguous = new ArrayList<>();
        List<String> orphaned = new ArrayList<>();
        for (EquipmentRow ammo : equipment) {
            if (ammo.category() != EquipmentCategory.AMMUNITION) {
                continue;
            }
            TechBase techBase = EquipmentCategory.techBaseOf(ammo.name());
            List<EquipmentRow> candidates = weaponsByKey.getOrDefault(ammoKey(ammo.name()), List.of()).stream()
                    .filter(w -> EquipmentCategory.techBaseOf(w.name()) == techBase)
                    .toList();
            if (candidates.size() == 1) {
                long weaponId = candidates.get(0).id();
                if (Objects.equals(ammo.ammoForId(), weaponId)) {
                    alreadyLinked++;
                } else {
                    session.linkAmmo(ammo.id(), weaponId);
                    linked++;
                }
            } else if (candidates.isEmpty()) {
                orphaned.add(ammo.slug());
            } else {
                log.debug("equipment.ammo.ambiguous slug={} candidates={}", ammo.slug(), candidates.size());
                ambiguous.add(ammo.slug());
            }
        }

        Result result = new Result(linked, alreadyLinked, ambiguous, orphaned);
        log.info("equipment.ammo.linked linked={} alreadyLinked={} ambiguous={} orphaned={}",
                linked, alreadyLinked, ambiguous.size(), orphaned.size());
        return result;
    }

    static String weaponKey(String name) {
        String key = compact(name);
        for (String prefix : PREFIXES) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                return key.substring(prefix.length());
            }
        }
        return key;
    }

    static String ammoKey(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        StringBuilder kept = new StringBuilder();
        for (String token : lower.split("[^a-z0-9/-]+")) {
            if (token.isEmpty() || isAmmoWord(token)) {
                continue;
            }
            kept.append(token).append(' ');
        }
        return weaponKey(kept.toString());
    }

    private static boolean isAmmoWord(String token) {
        for (String word : AMMO_WORDS) {
            if (word.equals(token)) {
                return true;
            }
        }
        return false;
    }

    private static String compact(String name) {
        StringBuilder out = new StringBuilder(name.length());
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * @param linked        links written in this pass
     * @param alreadyLinked ammunition already pointing at its unique parent
     * @param ambiguous     ammunition slugs with more than one candidate weapon
     * @param orphaned      ammunition slugs with no candidate weapon
     */
    public record Result(int linked, int alreadyLinked, List<String> ambiguous, List<String> orphaned) {
        public Result {
            ambiguous = List.copyOf(ambiguous);
            orphaned = List.copyOf(orphaned);
        }
    }
}
