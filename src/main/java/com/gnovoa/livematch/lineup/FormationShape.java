package com.gnovoa.livematch.lineup;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Derives shape labels such as {@code 4-3-3} or {@code 4-2-3-1} from position codes. */
public final class FormationShape {

    public enum Line { GOALKEEPER, DEFENSE, DEFENSIVE_MIDFIELD, MIDFIELD, ATTACKING_MIDFIELD, FORWARD }

    private static final Set<String> DEFENSE = Set.of("CB", "LCB", "RCB", "SW", "LB", "RB", "LWB", "RWB", "WB", "FB");
    private static final Set<String> DEFENSIVE_MIDFIELD = Set.of("CDM", "LDM", "RDM", "DM");
    private static final Set<String> MIDFIELD = Set.of("CM", "LCM", "RCM", "LM", "RM", "WM");
    private static final Set<String> ATTACKING_MIDFIELD = Set.of("CAM", "LAM", "RAM", "AM");

    private FormationShape() {}

    public static Line lineOf(String code) {
        String c = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        if (c.equals("GK")) return Line.GOALKEEPER;
        if (DEFENSE.contains(c)) return Line.DEFENSE;
        if (DEFENSIVE_MIDFIELD.contains(c)) return Line.DEFENSIVE_MIDFIELD;
        if (MIDFIELD.contains(c)) return Line.MIDFIELD;
        if (ATTACKING_MIDFIELD.contains(c)) return Line.ATTACKING_MIDFIELD;
        return Line.FORWARD;
    }

    /**
     * Goalkeepers are ignored. With attacking midfielders the label is
     * {@code def-(dm+cm)-am-fwd}, otherwise {@code def-(dm+cm+am)-fwd}; empty lines are dropped.
     */
    public static String label(Collection<String> positionCodes) {
        int def = 0, dm = 0, cm = 0, am = 0, fwd = 0;
        for (String code : positionCodes) {
            switch (lineOf(code)) {
                case GOALKEEPER -> { }
                case DEFENSE -> def++;
                case DEFENSIVE_MIDFIELD -> dm++;
                case MIDFIELD -> cm++;
                case ATTACKING_MIDFIELD -> am++;
                case FORWARD -> fwd++;
            }
        }
        List<Integer> groups = am > 0 ? List.of(def, dm + cm, am, fwd) : List.of(def, dm + cm, fwd);
        return groups.stream().filter(n -> n > 0).map(String::valueOf).collect(Collectors.joining("-"));
    }
}
