package finewine.acquisition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AcquisitionApplication {

  public static void main(String[] args) {
    SpringApplication.run(AcquisitionApplication.class, args);
  }
}
