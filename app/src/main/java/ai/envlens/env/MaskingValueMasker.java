package ai.envlens.env;

import ai.envlens.config.EnvLensConfig;

/** Replaces all but the first {@code showPrefix} characters of a value with the mask character. */
public final class MaskingValueMasker implements ValueMasker {
    private final boolean enabled;
    private final String maskChar;
    private final int showPrefix;

    public MaskingValueMasker(boolean enabled, String maskChar, int showPrefix) {
        this.enabled = enabled;
        this.maskChar = maskChar;
        this.showPrefix = showPrefix;
    }

    public static ValueMasker from(EnvLensConfig.Masking masking) {
        return masking.enabled()
                ? new MaskingValueMasker(true, masking.maskChar(), masking.showPrefix())
                : ValueMasker.PLAIN;
    }

    @Override
    public String display(ResolvedVariable variable) {
        var value = variable.value();
        if (!enabled || value.length() <= showPrefix) {
            return value;
        }
        return value.substring(0, showPrefix) + maskChar.repeat(value.length() - showPrefix);
    }
}
