package com.example.retrievalservice.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private JavaMailSender mailSender;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(mailSender, "sds@example.org", "rds@example.org");
    }

    private SimpleMailMessage sentMessage() {
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        return captor.getValue();
    }

    @Test
    void completionNoticeCarriesLinkAndValidity() {
        notificationService.sendCompleted("u@x.com", "http://h/sds/a.zip");

        SimpleMailMessage message = sentMessage();
        assertThat(message.getFrom()).isEqualTo("sds@example.org");
        assertThat(message.getTo()).containsExactly("u@x.com");
        assertThat(message.getSubject()).isEqualTo("Your requested archive is ready to download");
        assertThat(message.getText())
                .contains("http://h/sds/a.zip")
                .contains("valid only for 24 hours")
                .contains("rds@example.org");
    }

    @Test
    void failureNoticeNamesFile() {
        notificationService.sendFailed("u@x.com", "a.zip");

        SimpleMailMessage message = sentMessage();
        assertThat(message.getSubject()).isEqualTo("Failed on retrieving your requested archive");
        assertThat(message.getText()).contains("a.zip").contains("rds@example.org");
    }

    @Test
    void cancellationNoticeAsksToResubmit() {
        notificationService.sendCancelled("u@x.com", "a.zip");

        SimpleMailMessage message = sentMessage();
        assertThat(message.getSubject()).isEqualTo("Cancelled your request for archive");
        assertThat(message.getText()).contains("resubmit your request for a.zip");
    }

    @Test
    void sendErrorsPropagate() {
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> notificationService.sendFailed("u@x.com", "a.zip"))
                .isInstanceOf(MailSendException.class);
    }
}
