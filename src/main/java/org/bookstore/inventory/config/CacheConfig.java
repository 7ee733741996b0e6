package org.bookstore.inventory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.bookstore.inventory.service.dto.BookListing;

/**
 * Redis cache configuration for the Bookstore Service.
 *
 * <p><b>Book Listing Cache:</b>
 *
 * <ul>
 *   <li><b>Key:</b> a single entry, {@code bookstore-service:bookListing::all}
 *   <li><b>TTL:</b> {@code bookstore.cache.book-listing-ttl}, 60 seconds by default
 *   <li><b>Eviction:</b> every book create, update and delete calls {@code
 *       BookListingService.invalidate()} before returning
 *   <li><b>Transaction Awareness:</b> eviction issued inside a transaction is applied in the
 *       after-commit phase, so a reader can not repopulate the entry from uncommitted state, and a
 *       rolled-back write leaves the entry alone
 *   <li><b>Serialization:</b> JSON with a type-specific serializer, no default typing needed
 * </ul>
 *
 * <p><b>Failure Handling:</b> cache errors are logged and otherwise ignored. A failed read behaves
 * like a miss, so the listing is served from the database while Redis is unavailable.
 */
@Configuration
@EnableCaching
public class CacheConfig implements CachingConfigurer {

  /** Cache name for the denormalized book listing. */
  public static final String BOOK_LISTING_CACHE = "bookListing";

  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  @Bean
  public RedisCacheManagerBuilderCustomizer redisCacheManagerBuilderCustomizer(
      ObjectMapper objectMapper, BookstoreServiceProperties properties) {
    var cacheProperties = properties.getCache();
    var listingSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, BookListing.class);

    return builder ->
        builder
            .transactionAware()
            .withCacheConfiguration(
                BOOK_LISTING_CACHE,
                RedisCacheConfiguration.defaultCacheConfig()
                    .entryTtl(cacheProperties.getBookListingTtl())
                    .disableCachingNullValues()
                    .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            new StringRedisSerializer()))
                    .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            listingSerializer))
                    .prefixCacheNameWith(cacheProperties.getKeyPrefix()));
  }

  @Override
  public CacheErrorHandler errorHandler() {
    return new CacheErrorHandler() {
      @Override
      public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
        log.warn(
            "Cache read failed, falling back to database cache={} key={}: {}",
            cache.getName(),
            key,
            exception.getMessage());
      }

      @Override
      public void handleCachePutError(
          RuntimeException exception, Cache cache, Object key, Object value) {
        log.warn(
            "Cache write failed cache={} key={}: {}", cache.getName(), key, exception.getMessage());
      }

      @Override
      public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
        log.warn(
            "Cache eviction failed, entry expires by TTL cache={} key={}: {}",
            cache.getName(),
            key,
            exception.getMessage());
      }

      @Override
      public void handleCacheClearError(RuntimeException exception, Cache cache) {
        log.warn("Cache clear failed cache={}: {}", cache.getName(), exception.getMessage());
      }
    };
  }
}
