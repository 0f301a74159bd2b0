package at.sv.prayer;

/**
 * Signals a calculation input that is out of its valid range, e.g. a latitude beyond the poles or a negative
 * twilight angle.
 */
public class InvalidPropertyValue extends RuntimeException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
