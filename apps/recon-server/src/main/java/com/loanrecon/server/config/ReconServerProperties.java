package com.loanrecon.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recon")
public class ReconServerProperties {
  private final Dataset dataset = new Dataset();
  private final Query query = new Query();
  private final Server server = new Server();
  private final Session session = new Session();

  public Dataset getDataset() {
    return dataset;
  }

  public Query getQuery() {
    return query;
  }

  public Server getServer() {
    return server;
  }

  public Session getSession() {
    return session;
  }

  public static class Dataset {
    private String path;
    private final Reload reload = new Reload();

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public Reload getReload() {
      return reload;
    }
  }

  public static class Reload {
    private boolean enabled;
    private long fixedDelayMs = 60_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getFixedDelayMs() {
      return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
      this.fixedDelayMs = fixedDelayMs;
    }
  }

  public static class Query {
    private int defaultLimit = 100;
    private int defaultRankSize = 10;
    private int summarySampleSize = 10;
    private String firstPartyLabel = "servicer";
    private String secondPartyLabel = "fnma";

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getDefaultRankSize() {
      return defaultRankSize;
    }

    public void setDefaultRankSize(int defaultRankSize) {
      this.defaultRankSize = defaultRankSize;
    }

    public int getSummarySampleSize() {
      return summarySampleSize;
    }

    public void setSummarySampleSize(int summarySampleSize) {
      this.summarySampleSize = summarySampleSize;
    }

    public String getFirstPartyLabel() {
      return firstPartyLabel;
    }

    public void setFirstPartyLabel(String firstPartyLabel) {
      this.firstPartyLabel = firstPartyLabel;
    }

    public String getSecondPartyLabel() {
      return secondPartyLabel;
    }

    public void setSecondPartyLabel(String secondPartyLabel) {
      this.secondPartyLabel = secondPartyLabel;
    }
  }

  public static class Server {
    private String name = "loan-recon-server";
    private String version = "1.0.0";
    private String protocolVersion = "2024-11-05";

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getVersion() {
      return version;
    }

    public void setVersion(String version) {
      this.version = version;
    }

    public String getProtocolVersion() {
      return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
      this.protocolVersion = protocolVersion;
    }
  }

  public static class Session {
    private final Stdio stdio = new Stdio();

    public Stdio getStdio() {
      return stdio;
    }
  }

  public static class Stdio {
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
