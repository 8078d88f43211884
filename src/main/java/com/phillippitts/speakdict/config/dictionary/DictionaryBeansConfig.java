package com.phillippitts.speakdict.config.dictionary;

import com.phillippitts.speakdict.service.dictionary.compile.AnalyzerDictionaryBinding;
import com.phillippitts.speakdict.service.dictionary.compile.LoggingAnalyzerDictionaryBinding;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback beans for the user dictionary. A host application that embeds an analyzer
 * declares its own {@link AnalyzerDictionaryBinding} and this one steps aside.
 */
@Configuration
public class DictionaryBeansConfig {

    @Bean
    @ConditionalOnMissingBean(AnalyzerDictionaryBinding.class)
    public AnalyzerDictionaryBinding analyzerDictionaryBinding() {
        return new LoggingAnalyzerDictionaryBinding();
    }
}
