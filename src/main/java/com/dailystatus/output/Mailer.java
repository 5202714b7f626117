package com.dailystatus.output;

import com.dailystatus.app.properties.EmailProperties;
import com.dailystatus.app.properties.MailProperties;
import com.dailystatus.config.Config;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * SMTP mail sender.
 */
public final class Mailer {
    private static final Logger LOG = LogManager.getLogger(Mailer.class);

    public static final class Settings {
        public boolean enabled;
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public List<String> to;
        public String subjectPrefix;
        public boolean dryRun;
        public boolean failFast;
        public Path dryRunDir;
    }

    public Settings loadSettings(Config config, EmailProperties email, MailProperties mail) {
        Settings settings = new Settings();
        settings.enabled = email.isEnabled();
        settings.host = email.getSmtpHost();
        settings.port = email.getSmtpPort();
        settings.user = email.getSmtpUser();
        settings.pass = email.getSmtpPass();
        settings.from = isBlank(email.getFrom()) ? settings.user : email.getFrom();
        settings.to = email.getTo() == null ? List.of() : new ArrayList<>(email.getTo());
        settings.subjectPrefix = email.getSubjectPrefix() == null ? "" : email.getSubjectPrefix().trim();
        settings.dryRun = Boolean.TRUE.equals(mail.getDryRun());
        settings.failFast = mail.getFailFast() == null || mail.getFailFast();
        settings.dryRunDir = isBlank(mail.getDryRunDir())
                ? config.workingDir().resolve("mail_dry_run")
                : config.workingDir().resolve(mail.getDryRunDir()).normalize();
        return settings;
    }

    public boolean send(Settings s, RenderedReport report) throws MessagingException {
        if (!s.enabled) {
            LOG.info("Mail disabled (email.enabled=false), skip delivery.");
            return false;
        }
        String subject = s.subjectPrefix.isEmpty() ? report.subject() : s.subjectPrefix + " " + report.subject();

        if (s.dryRun) {
            try {
                writeDryRunArtifacts(s, subject, report.text(), report.html());
                LOG.info("Mail dry-run saved. dir={}", s.dryRunDir.toAbsolutePath());
                return true;
            } catch (Exception e) {
                handleFailure(s, "dry_run_write_failed", e);
            }
            return false;
        }

        if (isBlank(s.host) || isBlank(s.user) || isBlank(s.pass) || s.to == null || s.to.isEmpty()) {
            handleFailure(s, "smtp_settings_incomplete", new IllegalArgumentException("email enabled but smtp settings are incomplete"));
            return false;
        }

        try {
            Properties props = new Properties();
            props.put("mail.smtp.auth", "true");
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.host", s.host);
            props.put("mail.smtp.port", String.valueOf(s.port));

            Session session = Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(s.user, s.pass);
                }
            });

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(s.from));
            String toJoined = s.to.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.joining(","));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(toJoined));
            message.setSubject(subject, "UTF-8");

            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(report.text(), "UTF-8");
            alternative.addBodyPart(textPart);
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setContent(report.html(), "text/html; charset=UTF-8");
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);

            Transport.send(message);
            LOG.info("Mail sent to {}", maskAddresses(s.to));
            return true;
        } catch (Exception e) {
            handleFailure(s, "smtp_send_failed", e);
            return false;
        }
    }

    private void writeDryRunArtifacts(Settings s, String subject, String textBody, String htmlBody) throws Exception {
        Files.createDirectories(s.dryRunDir);
        String stamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC).format(Instant.now());
        Path emlPath = s.dryRunDir.resolve("mail_" + stamp + ".eml");
        Path htmlPath = s.dryRunDir.resolve("mail_" + stamp + ".html");
        Path txtPath = s.dryRunDir.resolve("mail_" + stamp + ".txt");

        String eml = "From: " + safe(s.from) + "\n"
                + "To: " + (s.to == null ? "" : String.join(",", s.to)) + "\n"
                + "Subject: " + safe(subject) + "\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: text/html; charset=UTF-8\n\n"
                + safe(htmlBody);
        Files.writeString(emlPath, eml, StandardCharsets.UTF_8);
        Files.writeString(htmlPath, safe(htmlBody), StandardCharsets.UTF_8);
        Files.writeString(txtPath, safe(textBody), StandardCharsets.UTF_8);
    }

    private void handleFailure(Settings s, String stage, Exception e) throws MessagingException {
        String message = "Mail send failed stage=" + stage
                + " smtp=" + safe(s.host) + ":" + s.port
                + " from=" + maskAddress(s.from)
                + " to=" + maskAddresses(s.to)
                + " err=" + (e == null ? "" : safe(e.getMessage()));

        if (s.failFast) {
            if (e instanceof MessagingException) {
                throw (MessagingException) e;
            }
            throw new MessagingException(message, e);
        }

        LOG.warn(message);
    }

    private String maskAddresses(List<String> to) {
        if (to == null || to.isEmpty()) {
            return "";
        }
        return to.stream().map(this::maskAddress).collect(Collectors.joining(","));
    }

    private String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (local.length() <= 1) {
            return "*@" + domain;
        }
        return local.substring(0, 1) + "***@" + domain;
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
