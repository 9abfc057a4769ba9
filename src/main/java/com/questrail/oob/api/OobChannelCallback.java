package com.questrail.oob.api;

/**
 * Outcome sink for {@link OobChannel}.
 *
 * <p>For each activation exactly one of these methods is invoked, unless the
 * activation is cancelled, in which case neither is. Callbacks run on the
 * channel's worker thread.</p>
 */
public interface OobChannelCallback
{
    /**
     * A complete frame was received and decoded.
     *
     * @param token the decoded verification token
     */
    void onSuccess(OobToken token);

    /**
     * The activation failed. The cause is available only through the
     * channel's observability sink.
     */
    void onFailure();
}
