package com.phillippitts.speakdict;

import com.phillippitts.speakdict.config.dictionary.CompilerProperties;
import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DictionaryProperties.class,
        CompilerProperties.class
})
public class SpeakDictApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakDictApplication.class, args);
    }

}
