package ai.envlens.env;

/** @param clearCaches drop any cached values before re-reading sources */
public record RefreshOptions(boolean clearCaches) {

    public static final RefreshOptions DEFAULT = new RefreshOptions(false);
}
