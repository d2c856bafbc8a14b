package com.flamingo.ai.chatarchive.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for export parsing and search. */
@Configuration
@ConfigurationProperties(prefix = "archive")
@Validated
@Getter
@Setter
public class ArchiveProperties {

  @Valid private Ranking ranking = new Ranking();
  @Valid private Snippet snippet = new Snippet();
  @Valid private Progress progress = new Progress();
  @Valid private Lookup lookup = new Lookup();
  @Valid private Decoder decoder = new Decoder();

  @Getter
  @Setter
  public static class Ranking {
    /** Term-frequency saturation. */
    @DecimalMin("0.0")
    private double k1 = 1.5;

    /** Document-length normalization, 0 disables it. */
    @DecimalMin("0.0")
    private double b = 0.75;
  }

  @Getter
  @Setter
  public static class Snippet {
    @Positive private int maxLength = 100;

    /** Characters kept before the first match. */
    @PositiveOrZero private int leadingContext = 20;
  }

  @Getter
  @Setter
  public static class Progress {
    @Positive private int itemInterval = 100;
    @NotNull private Duration timeInterval = Duration.ofSeconds(2);
  }

  @Getter
  @Setter
  public static class Lookup {
    @Positive private int minPrefixLength = 4;
  }

  @Getter
  @Setter
  public static class Decoder {
    /** Largest single JSON string value accepted, in characters. */
    @Positive private int maxStringLength = 200_000_000;
  }
}
