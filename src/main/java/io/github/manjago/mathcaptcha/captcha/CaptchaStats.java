package io.github.manjago.mathcaptcha.captcha;

/**
 * Snapshot of captcha manager statistics.
 */
public record CaptchaStats(
    long generated,       // images produced
    long failed,          // generate calls that failed
    long deduplicated,    // generate calls that joined an existing key
    long expired,         // removed by the expiry timer
    long cleanedUp,       // removed explicitly
    int tracked           // records currently in the map (pending + ready)
) {

    /**
     * Fraction of generate attempts that failed.
     */
    public double failureRate() {
        long attempts = generated + failed;
        return attempts > 0 ? (double) failed / attempts : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Captcha Statistics ===
            Generated:     %,d
            Failed:        %,d (%.1f%%)
            Deduplicated:  %,d
            Expired:       %,d
            Cleaned up:    %,d
            Tracked now:   %,d
            """,
            generated,
            failed, failureRate() * 100,
            deduplicated,
            expired,
            cleanedUp,
            tracked
        );
    }
}
