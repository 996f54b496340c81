package com.unit.catalog.reference;

/**
 * A faction that may field units.
 *
 * @param slug        unique slug
 * @param name        display name
 * @param shortName   abbreviation, may be null for auto-created factions
 * @param factionType one of great_house, clan, periphery, mercenary, star_league,
 *                    independent, inner_sphere, general, other
 * @param clan        whether the faction is a Clan
 */
public record Faction(String slug, String name, String shortName, String factionType, boolean clan) {}
