package world.willfrog.contract.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record Policy(boolean piiAllowed, Set<String> complianceTags, Set<String> allowedTools) {

    public Policy {
        complianceTags = complianceTags == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(complianceTags));
        allowedTools = allowedTools == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedTools));
    }
}
