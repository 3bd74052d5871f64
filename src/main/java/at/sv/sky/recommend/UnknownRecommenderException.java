package at.sv.sky.recommend;

public class UnknownRecommenderException extends RuntimeException {
    public UnknownRecommenderException(String message) {
        super(message);
    }
}
