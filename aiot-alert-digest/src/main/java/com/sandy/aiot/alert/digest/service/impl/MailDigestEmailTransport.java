package com.sandy.aiot.alert.digest.service.impl;

import com.sandy.aiot.alert.digest.service.DigestEmailComposer;
import com.sandy.aiot.alert.digest.service.DigestEmailTransport;
import com.sandy.aiot.alert.digest.vo.DigestEmail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. MailException means failure.
 */
@Service
@Profile("!test")
@Slf4j
@RequiredArgsConstructor
public class MailDigestEmailTransport implements DigestEmailTransport {

    private final JavaMailSender mailSender;
    private final DigestEmailComposer composer;

    @Value("${digest.email.from:PureTrack Alerts <alerts@localhost>}")
    private String from;

    @Override
    public void send(DigestEmail email) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(email.getRecipientEmail());
        message.setSubject(composer.subject(email));
        message.setText(composer.body(email));
        mailSender.send(message);
        log.debug("SMTP accepted digest {} for {}", email.getDigestId(), email.getRecipientEmail());
    }
}
