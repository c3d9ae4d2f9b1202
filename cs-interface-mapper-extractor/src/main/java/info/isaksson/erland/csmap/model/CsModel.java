package info.isaksson.erland.csmap.model;

import java.util.ArrayList;
import java.util.List;

/** Aggregate handed to report writers: parsed units, resolved edges and per-file diagnostics. */
public final class CsModel {
    public final List<CsUnit> units = new ArrayList<>();
    public final List<DependencyEdge> dependencyEdges = new ArrayList<>();
    /** Files that could not be processed; they are not part of {@link #units}. */
    public final List<UnitParseFailure> failures = new ArrayList<>();

    public CsUnit unit(String id) {
        for (CsUnit u : units) {
            if (u.id.equals(id)) return u;
        }
        return null;
    }

    public int typeCount() {
        int n = 0;
        for (CsUnit u : units) n += u.types.size();
        return n;
    }
}
