package io.b2mash.b2b.collab.notification;

import io.b2mash.b2b.collab.integration.email.SendResult;
import io.b2mash.b2b.collab.project.Project;

/**
 * Tells a recipient about an invitation. Failures are reported in the {@link SendResult}; callers
 * treat them as warnings and never roll back on them.
 */
public interface InvitationNotifier {

  SendResult sendInvitation(String recipientEmail, Project project, String inviteUrl);
}
