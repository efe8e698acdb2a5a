package era.rank.mining;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class MatchCandidate {
    private final PersonRef personRef;
    private final String displayName;
    private final double similarity;
    // Position in identity creation order, used to break similarity ties
    private final int creationRank;

    public MatchCandidate(PersonRef personRef, String displayName, double similarity, int creationRank) {
        this.personRef = personRef;
        this.displayName = displayName;
        this.similarity = similarity;
        this.creationRank = creationRank;
    }

    MatchCandidate withSimilarity(double value) {
        return new MatchCandidate(personRef, displayName, value, creationRank);
    }
}
