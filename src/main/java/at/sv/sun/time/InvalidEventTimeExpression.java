package at.sv.sun.time;

public final class InvalidEventTimeExpression extends RuntimeException {

    public InvalidEventTimeExpression(String message) {
        super(message);
    }
}
