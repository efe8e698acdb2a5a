package era.rank.ranking;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public class RankedPhoto implements Comparable<RankedPhoto> {
    private final String filename;
    private final double score;

    public RankedPhoto(String filename, double score) {
        this.filename = filename;
        this.score = score;
    }

    @Override
    public int compareTo(RankedPhoto other) {
        int status = Double.compare(other.score, this.score);
        if (status != 0) {
            return status;
        }
        return this.filename.compareTo(other.filename);
    }

    @Override
    public String toString() {
        return String.format("%-40s %.4f", filename, score);
    }
}
