package nl.infomedics.perio.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@NoArgsConstructor @AllArgsConstructor @Getter @Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "records")
public class RecordsProperties {
	@NotBlank
	private String path = "records.yaml";
	private boolean bootstrapMissingFile = true; // false: a missing file fails the load
	private boolean prettyOutput = true;
}
