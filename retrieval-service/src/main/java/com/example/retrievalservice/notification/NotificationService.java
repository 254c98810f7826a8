package com.example.retrievalservice.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * Plain-text email notices sent to requesters.
 * Send failures surface as {@link org.springframework.mail.MailException}; callers decide whether they matter.
 */
@Service
@Slf4j
public class NotificationService {

    static final String COMPLETED_SUBJECT = "Your requested archive is ready to download";
    static final String FAILED_SUBJECT = "Failed on retrieving your requested archive";
    static final String CANCELLED_SUBJECT = "Cancelled your request for archive";

    private final JavaMailSender mailSender;
    private final String sender;
    private final String contactEmail;

    public NotificationService(
            JavaMailSender mailSender,
            @Value("${retrieval.mail.sender:sds-noreply@localhost}") String sender,
            @Value("${retrieval.mail.contact:rds@localhost}") String contactEmail) {
        this.mailSender = mailSender;
        this.sender = sender;
        this.contactEmail = contactEmail;
    }

    public void sendCompleted(String recipient, String downloadLink) {
        String text = "You can now download your archive via the link below; please note that the link is "
                + "valid only for 24 hours.\n" + downloadLink + "\n\n"
                + "Please contact Research Data Services (RDS) at " + contactEmail
                + " if you need any assistance.\n";
        send(recipient, COMPLETED_SUBJECT, text);
    }

    public void sendFailed(String recipient, String filename) {
        String text = "We encountered an issue when retrieving your requested archive:\n\n" + filename + "\n\n"
                + "Please contact Research Data Services (RDS) at " + contactEmail + " for assistance.\n";
        send(recipient, FAILED_SUBJECT, text);
    }

    public void sendCancelled(String recipient, String filename) {
        String text = "SDS is currently processing its maximum number of requests. "
                + "The system has cancelled your request.\n\n"
                + "Please resubmit your request for " + filename + " at a later time.\n\n"
                + "Please contact Research Data Services (RDS) at " + contactEmail
                + " if you need any assistance.\n";
        send(recipient, CANCELLED_SUBJECT, text);
    }

    private void send(String recipient, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(sender);
        message.setTo(recipient);
        message.setSubject(subject);
        message.setText(text);
        mailSender.send(message);
        log.info("Sent '{}' to {}", subject, recipient);
    }
}
