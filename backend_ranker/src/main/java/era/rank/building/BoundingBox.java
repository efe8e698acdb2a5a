package era.rank.building;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class BoundingBox {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double width() {
        return Math.max(0.0, x2 - x1);
    }

    public double height() {
        return Math.max(0.0, y2 - y1);
    }

    public double shorterSide() {
        return Math.min(width(), height());
    }

    public double area() {
        return width() * height();
    }

    /**
     * Integer pixel region inside an image of the given size, or null when nothing is left
     * after clamping.
     */
    public int[] clampedPixels(int imageWidth, int imageHeight) {
        int x0 = Math.max(0, (int) Math.round(x1));
        int y0 = Math.max(0, (int) Math.round(y1));
        int x = Math.min(imageWidth, (int) Math.round(x2));
        int y = Math.min(imageHeight, (int) Math.round(y2));
        if (x <= x0 || y <= y0) {
            return null;
        }
        return new int[] {x0, y0, x - x0, y - y0};
    }

    public List<Double> toList() {
        return List.of(x1, y1, x2, y2);
    }

    public static BoundingBox fromList(List<?> values) {
        if (values == null || values.size() < 4) {
            throw new IllegalArgumentException("Bounding box needs 4 coordinates");
        }
        return new BoundingBox(
            ((Number) values.get(0)).doubleValue(),
            ((Number) values.get(1)).doubleValue(),
            ((Number) values.get(2)).doubleValue(),
            ((Number) values.get(3)).doubleValue());
    }
}
