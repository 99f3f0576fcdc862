package Model;

public enum HashFamily {
    AVERAGE,
    DIFFERENCE,
    PERCEPTIVE
}
