package Model;

public record IndexStatus(String location, long directories, long images, long hashes) {}
