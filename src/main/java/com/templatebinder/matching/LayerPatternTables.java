package com.templatebinder.matching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered layer-name pattern tables, one per category.
 */
public final class LayerPatternTables {

    public static final List<LayerPattern> TEAM = List.of(
        new LayerPattern("team", "^(home|away)Team(Name|Abbreviation|Rank|Color1|Color2)$", 1.0),
        new LayerPattern("team", "^(home|away)_?team_?(name|abbr|rank|color)s?$", 0.9),
        new LayerPattern("team", "^team[_\\s]?(home|away)[_\\s]?(name|abbr)?$", 0.8)
    );

    public static final List<LayerPattern> SCORE = List.of(
        new LayerPattern("score", "^(home|away)TeamScore[1-5]?$", 1.0),
        new LayerPattern("score", "^(home|away)_?score[_\\s]?[1-5]?$", 0.9),
        new LayerPattern("score", "^score[_\\s]?(home|away)[_\\s]?[1-5]?$", 0.8),
        new LayerPattern("score", "^(home|away)[_\\s]?pts?[_\\s]?[1-5]?$", 0.7)
    );

    public static final List<LayerPattern> EVENT = List.of(
        new LayerPattern("event", "^event(Month|Day|Year|Time|City|State|Venue|Date).*$", 1.0),
        new LayerPattern("event", "^(date|time|city|state|venue|location)$", 0.8),
        new LayerPattern("event", "^game[_\\s]?(date|time|city|venue)$", 0.8)
    );

    public static final List<LayerPattern> PLAYER = List.of(
        new LayerPattern("player",
            "^player(\\d{1,2})(FirstName|LastName|FullName|Number|Position|Height|Weight|Year|Stats)$", 1.0),
        new LayerPattern("player",
            "^player[_\\s]?(\\d{1,2})[_\\s]?(first|last|full)?[_\\s]?(name|number|pos|stats?)$", 0.9),
        new LayerPattern("player", "^p(\\d{1,2})[_\\s]?(name|number|position)$", 0.8)
    );

    public static final List<LayerPattern> STATUS = List.of(
        new LayerPattern("status", "^status(Text)?$", 1.0),
        new LayerPattern("status", "^(final|live|pregame)[_\\s]?(badge|indicator|status)?$", 0.9),
        new LayerPattern("status", "^game[_\\s]?status$", 0.8)
    );

    public static final List<LayerPattern> LOGO = List.of(
        new LayerPattern("logo", "^(home|away)TeamLogo(SingleColor)?$", 1.0),
        new LayerPattern("logo", "^(home|away)[_\\s]?logo[_\\s]?(mono|single|color)?$", 0.9),
        new LayerPattern("logo", "^(opponent|league)Logo$", 1.0),
        new LayerPattern("logo", "^logo[_\\s]?(home|away|opp|league)$", 0.8)
    );

    public static final List<LayerPattern> IMAGE = List.of(
        new LayerPattern("image", "^featuredImage[1-3]$", 1.0),
        new LayerPattern("image", "^featured[_\\s]?image[_\\s]?[1-3]?$", 0.9),
        new LayerPattern("image", "^hero[_\\s]?image$", 0.7)
    );

    private LayerPatternTables() {
    }

    /**
     * Tables in the order the pattern strategy consults them.
     */
    public static List<LayerPattern> dispatchOrder(PatternLookupMode mode) {
        List<LayerPattern> ordered = new ArrayList<>();
        ordered.addAll(TEAM);
        ordered.addAll(SCORE);
        ordered.addAll(EVENT);
        ordered.addAll(PLAYER);
        if (mode == PatternLookupMode.NORMALIZED) {
            ordered.addAll(STATUS);
            ordered.addAll(LOGO);
            ordered.addAll(IMAGE);
        }
        return Collections.unmodifiableList(ordered);
    }
}
