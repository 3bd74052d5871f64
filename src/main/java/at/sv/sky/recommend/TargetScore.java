package at.sv.sky.recommend;

import java.util.List;

/**
 * @param score   [0, 100]
 * @param reasons one entry per rule that fired, in evaluation order
 */
public record TargetScore(int score, List<String> reasons) {

    public TargetScore {
        reasons = List.copyOf(reasons);
    }
}
