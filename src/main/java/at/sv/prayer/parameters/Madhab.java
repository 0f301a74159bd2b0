package at.sv.prayer.parameters;

/**
 * School of jurisprudence, which determines the start of Asr.
 */
public enum Madhab {
    SHAFI(1),
    HANAFI(2);

    private final int shadowLength;

    Madhab(int shadowLength) {
        this.shadowLength = shadowLength;
    }

    /**
     * @return the multiple of an object's height its shadow has to exceed its noon shadow by at the start of Asr
     */
    public int getShadowLength() {
        return shadowLength;
    }
}
