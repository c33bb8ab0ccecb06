package io.b2mash.b2b.collab.notification;

import io.b2mash.b2b.collab.integration.email.EmailMessage;
import io.b2mash.b2b.collab.integration.email.EmailProvider;
import io.b2mash.b2b.collab.integration.email.RenderedEmail;
import io.b2mash.b2b.collab.integration.email.SendResult;
import io.b2mash.b2b.collab.member.UserDirectory;
import io.b2mash.b2b.collab.notification.template.EmailTemplateRenderer;
import io.b2mash.b2b.collab.project.Project;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Renders the project-invitation template and hands it to the configured email provider. */
@Component
public class EmailInvitationNotifier implements InvitationNotifier {

  private static final Logger log = LoggerFactory.getLogger(EmailInvitationNotifier.class);

  static final String TEMPLATE = "project-invitation";

  private final EmailTemplateRenderer renderer;
  private final EmailProvider emailProvider;
  private final UserDirectory userDirectory;

  public EmailInvitationNotifier(
      EmailTemplateRenderer renderer, EmailProvider emailProvider, UserDirectory userDirectory) {
    this.renderer = renderer;
    this.emailProvider = emailProvider;
    this.userDirectory = userDirectory;
  }

  @Override
  public SendResult sendInvitation(String recipientEmail, Project project, String inviteUrl) {
    var owner = userDirectory.findById(project.getOwnerId());
    String ownerName =
        owner.map(u -> u.name() != null ? u.name() : u.email()).orElse("A project owner");

    var context = new HashMap<String, Object>();
    context.put("subject", "You're invited to collaborate on " + project.getName());
    context.put("projectName", project.getName());
    context.put("projectDescription", project.getDescription());
    context.put("ownerName", ownerName);
    context.put("inviteUrl", inviteUrl);

    RenderedEmail rendered;
    try {
      rendered = renderer.render(TEMPLATE, context);
    } catch (RuntimeException e) {
      log.warn("Failed to render invitation email for project {}", project.getId(), e);
      return SendResult.failed("Email could not be rendered: " + e.getMessage());
    }
    var message =
        EmailMessage.withReference(
            recipientEmail,
            rendered,
            owner.map(u -> u.email()).orElse(null),
            "PROJECT_INVITATION",
            project.getId().toString());

    var result = emailProvider.sendEmail(message);
    log.debug(
        "Invitation email for project {} via {}: success={}",
        project.getId(),
        emailProvider.providerId(),
        result.success());
    return result;
  }
}
