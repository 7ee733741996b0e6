package org.bookstore.inventory.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "bookstore")
@Validated
public class BookstoreServiceProperties {

  @Valid private StockAlert stockAlert = new StockAlert();
  @Valid private Notifications notifications = new Notifications();
  @Valid private Cache cache = new Cache();
  @Valid private Export export = new Export();

  public StockAlert getStockAlert() {
    return stockAlert;
  }

  public void setStockAlert(StockAlert stockAlert) {
    this.stockAlert = stockAlert;
  }

  public Notifications getNotifications() {
    return notifications;
  }

  public void setNotifications(Notifications notifications) {
    this.notifications = notifications;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Export getExport() {
    return export;
  }

  public void setExport(Export export) {
    this.export = export;
  }

  public static class StockAlert {

    /** Books with stock strictly below this value are reported. */
    @Min(1)
    private int threshold = 5;

    /** Maximum number of titles named in one alert message. */
    @Min(1)
    @Max(50)
    private int maxTitles = 5;

    /** Time zone calendar triggers are evaluated in. */
    @NotBlank private String zone = "UTC";

    /** Cron expression for the global low-stock sweep; "-" disables it. */
    @NotBlank private String sweepCron = "0 0 * * * *";

    /** Upper bound on how long one firing may hold its cluster lock. */
    @NotNull private Duration lockAtMostFor = Duration.ofMinutes(5);

    public int getThreshold() {
      return threshold;
    }

    public void setThreshold(int threshold) {
      this.threshold = threshold;
    }

    public int getMaxTitles() {
      return maxTitles;
    }

    public void setMaxTitles(int maxTitles) {
      this.maxTitles = maxTitles;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }

    public String getSweepCron() {
      return sweepCron;
    }

    public void setSweepCron(String sweepCron) {
      this.sweepCron = sweepCron;
    }

    public Duration getLockAtMostFor() {
      return lockAtMostFor;
    }

    public void setLockAtMostFor(Duration lockAtMostFor) {
      this.lockAtMostFor = lockAtMostFor;
    }
  }

  public static class Notifications {

    /** Broadcast channel name on the pub/sub transport. */
    @NotBlank private String channel = "book_updates";

    /** STOMP destination connected clients subscribe to. */
    @NotBlank private String destination = "/topic/book_updates";

    /** Transport used to fan events out across instances. */
    @NotNull private Transport transport = Transport.REDIS;

    public String getChannel() {
      return channel;
    }

    public void setChannel(String channel) {
      this.channel = channel;
    }

    public String getDestination() {
      return destination;
    }

    public void setDestination(String destination) {
      this.destination = destination;
    }

    public Transport getTransport() {
      return transport;
    }

    public void setTransport(Transport transport) {
      this.transport = transport;
    }

    public enum Transport {
      /** Redis pub/sub, relayed to STOMP clients by every instance. */
      REDIS,
      /** In-process STOMP broker only. */
      LOCAL
    }
  }

  public static class Cache {

    /** Time-to-live of the cached book listing. */
    @NotNull private Duration bookListingTtl = Duration.ofSeconds(60);

    /** Key prefix separating this service's entries in a shared Redis. */
    @NotBlank private String keyPrefix = "bookstore-service:";

    public Duration getBookListingTtl() {
      return bookListingTtl;
    }

    public void setBookListingTtl(Duration bookListingTtl) {
      this.bookListingTtl = bookListingTtl;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }

  public static class Export {

    /** Directory CSV exports are written to. Created on first export. */
    @NotBlank private String directory = "exports";

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }
  }
}
