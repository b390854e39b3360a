package io.b2mash.formlogic.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the form logic engine.
 *
 * @param packLocation resource pattern the form pack loader scans for structure snapshots
 * @param loadPacks whether form packs are loaded at startup
 * @param sessionIdleTimeout how long an untouched fill-out session is kept
 * @param maxSessions upper bound on live fill-out sessions
 * @param maxSkipChain how many fully skipped pages navigation may pass in one transition
 */
@ConfigurationProperties(prefix = "formlogic")
public record FormLogicProperties(
    @DefaultValue("classpath*:form-packs/*.json") String packLocation,
    @DefaultValue("true") boolean loadPacks,
    @DefaultValue("30m") Duration sessionIdleTimeout,
    @DefaultValue("10000") long maxSessions,
    @DefaultValue("10") int maxSkipChain) {}
