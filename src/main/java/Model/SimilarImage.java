package Model;

public record SimilarImage(IndexedImage image, double distance) {}
