package com.mk.fx.qa.dicom.load.cfg;

import com.mk.fx.qa.dicom.load.catalog.DatasetCatalog;
import com.mk.fx.qa.dicom.load.catalog.SizeThresholds;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Size bucket boundaries and the catalog bean built from them. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dicom.load.catalog")
public class CatalogCfg {

  @Positive private long mediumFromBytes = SizeThresholds.DEFAULT_MEDIUM_FROM_BYTES;

  @Positive private long largeFromBytes = SizeThresholds.DEFAULT_LARGE_FROM_BYTES;

  @Bean
  public DatasetCatalog datasetCatalog() {
    return new DatasetCatalog(new SizeThresholds(mediumFromBytes, largeFromBytes));
  }
}
