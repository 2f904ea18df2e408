package fakedb;

public record AddedStep(int id, int number, String name) {
}
