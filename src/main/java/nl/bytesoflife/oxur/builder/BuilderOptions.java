package nl.bytesoflife.oxur.builder;

/**
 * Settings for an {@link AstBuilder}.
 */
public class BuilderOptions {

    private IdPolicy idPolicy = IdPolicy.HIGH_WATER_MARK;
    private boolean strictModifiers = false;

    public IdPolicy getIdPolicy() {
        return idPolicy;
    }

    public BuilderOptions setIdPolicy(IdPolicy idPolicy) {
        if (idPolicy == null) {
            throw new IllegalArgumentException("idPolicy must not be null");
        }
        this.idPolicy = idPolicy;
        return this;
    }

    /**
     * When false (the default) an unrecognized {@code :safety}, {@code :constness} or
     * {@code :defaultness} symbol falls back to the field's default and a warning is logged.
     * When true it is an error, like every other unrecognized tag.
     */
    public boolean isStrictModifiers() {
        return strictModifiers;
    }

    public BuilderOptions setStrictModifiers(boolean strictModifiers) {
        this.strictModifiers = strictModifiers;
        return this;
    }

    @Override
    public String toString() {
        return "BuilderOptions{idPolicy=" + idPolicy + ", strictModifiers=" + strictModifiers + "}";
    }
}
