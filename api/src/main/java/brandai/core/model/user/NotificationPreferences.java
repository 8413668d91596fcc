package brandai.core.model.user;

/**
 * Notification and writing preferences attached to a user account.
 *
 * @param cadence  how often suggestions are sent (default weekly)
 * @param tone     preferred tone (default formal)
 * @param emojis   whether generated content may use emojis (default false)
 * @param hashtags whether generated content may use hashtags (default true)
 */
public record NotificationPreferences(Cadence cadence, Tone tone, boolean emojis, boolean hashtags) {

    public NotificationPreferences {
        if (cadence == null) {
            cadence = Cadence.WEEKLY;
        }
        if (tone == null) {
            tone = Tone.FORMAL;
        }
    }

    public static NotificationPreferences defaults() {
        return new NotificationPreferences(Cadence.WEEKLY, Tone.FORMAL, false, true);
    }
}
