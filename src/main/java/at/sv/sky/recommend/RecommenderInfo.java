package at.sv.sky.recommend;

public record RecommenderInfo(String id, String name, String description) {
}
