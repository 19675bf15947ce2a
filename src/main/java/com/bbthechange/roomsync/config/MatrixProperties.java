package com.bbthechange.roomsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Settings for the Matrix homeserver the service administers rooms on.
 */
@Component
@ConfigurationProperties(prefix = "matrix")
public class MatrixProperties {

    private String homeserverUrl = "http://localhost:8448";

    /** Server name used as the domain of every alias and user id. */
    private String serverName = "matrix.openmeet.net";

    /** Application service token the bot authenticates with (as_token). */
    private String accessToken = "";

    /** Token the homeserver presents on federation callbacks (hs_token). */
    private String homeserverToken = "";

    /** Localpart prefix of the per-tenant automation actor. */
    private String botUsername = "openmeet-bot";

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration connectTimeout = Duration.ofSeconds(5);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration requestTimeout = Duration.ofSeconds(10);

    private int maxRetries = 3;

    @DurationUnit(ChronoUnit.MILLIS)
    private Duration retryBackoff = Duration.ofMillis(500);

    /** Power level the bot is elevated to when it has lost room privileges. */
    private int adminPowerLevel = 100;

    /** Fallback level needed to change power levels when the room does not say. */
    private int powerLevelThreshold = 50;

    private String roomPreset = "private_chat";

    public String getHomeserverUrl() {
        return homeserverUrl;
    }

    public void setHomeserverUrl(String homeserverUrl) {
        this.homeserverUrl = homeserverUrl;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getHomeserverToken() {
        return homeserverToken;
    }

    public void setHomeserverToken(String homeserverToken) {
        this.homeserverToken = homeserverToken;
    }

    public String getBotUsername() {
        return botUsername;
    }

    public void setBotUsername(String botUsername) {
        this.botUsername = botUsername;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getAdminPowerLevel() {
        return adminPowerLevel;
    }

    public void setAdminPowerLevel(int adminPowerLevel) {
        this.adminPowerLevel = adminPowerLevel;
    }

    public int getPowerLevelThreshold() {
        return powerLevelThreshold;
    }

    public void setPowerLevelThreshold(int powerLevelThreshold) {
        this.powerLevelThreshold = powerLevelThreshold;
    }

    public String getRoomPreset() {
        return roomPreset;
    }

    public void setRoomPreset(String roomPreset) {
        this.roomPreset = roomPreset;
    }
}
