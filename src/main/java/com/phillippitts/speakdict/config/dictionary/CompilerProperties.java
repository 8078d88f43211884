package com.phillippitts.speakdict.config.dictionary;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration for the external dictionary compiler (mecab-dict-index).
 * Binds to properties prefixed with "speakdict.compiler".
 *
 * <p>Example application.properties:
 * <pre>
 * speakdict.compiler.binary-path=tools/open_jtalk/bin/mecab-dict-index
 * speakdict.compiler.system-dic-dir=tools/open_jtalk/dic
 * speakdict.compiler.timeout-seconds=60
 * speakdict.compiler.max-output-bytes=65536
 * </pre>
 *
 * @param binaryPath path to the mecab-dict-index executable
 * @param systemDicDir system dictionary directory (matrix.def, left-id.def, ...) the user
 *                     dictionary is compiled against
 * @param timeoutSeconds maximum time a single compilation may take
 * @param maxOutputBytes cap on captured stdout/stderr per stream
 */
@ConfigurationProperties(prefix = "speakdict.compiler")
@Validated
public record CompilerProperties(
        @NotBlank(message = "Compiler binary path must not be blank")
        @DefaultValue("tools/open_jtalk/bin/mecab-dict-index")
        String binaryPath,

        @NotBlank(message = "System dictionary directory must not be blank")
        @DefaultValue("tools/open_jtalk/dic")
        String systemDicDir,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("60")
        int timeoutSeconds,

        @Positive(message = "Max output bytes must be positive")
        @DefaultValue("65536")
        int maxOutputBytes
) {
}
