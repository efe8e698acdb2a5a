package era.rank.mining;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class MatchResult {
    private final boolean matched;
    private final List<MatchCandidate> candidates;

    public MatchResult(boolean matched, List<MatchCandidate> candidates) {
        this.matched = matched;
        this.candidates = Collections.unmodifiableList(candidates);
    }

    /**
     * The matched person, empty when nothing reached the threshold.
     */
    public Optional<MatchCandidate> best() {
        if (!matched || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }
}
