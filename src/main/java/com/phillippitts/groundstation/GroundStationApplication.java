package com.phillippitts.groundstation;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.config.properties.SpeechServiceProperties;
import com.phillippitts.groundstation.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        BrokerProperties.class,
        SpeechServiceProperties.class,
        SatelliteProperties.class,
        ThreadPoolProperties.class
})
public class GroundStationApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroundStationApplication.class, args);
    }

}
