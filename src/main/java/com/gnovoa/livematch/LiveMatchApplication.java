// Namespace
package com.gnovoa.livematch;

// Imports
import com.gnovoa.livematch.access.ViewerProperties;
import com.gnovoa.livematch.broadcast.BroadcastProperties;
import com.gnovoa.livematch.cache.CacheProperties;
import com.gnovoa.livematch.positions.PositionProperties;
import com.gnovoa.livematch.quota.QuotaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;

/** The Main app */
@SpringBootApplication
@EnableCaching
@EnableConfigurationProperties({
  CacheProperties.class,
  QuotaProperties.class,
  PositionProperties.class,
  BroadcastProperties.class,
  ViewerProperties.class
})
public class LiveMatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiveMatchApplication.class, args);
  }
}
