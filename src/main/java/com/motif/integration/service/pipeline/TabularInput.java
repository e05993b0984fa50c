package com.motif.integration.service.pipeline;

import org.springframework.core.io.InputStreamSource;

/**
 * One uploaded tabular (CSV) file.
 *
 * @param fileName original file name
 * @param content  file content, read once when the run workspace is prepared
 */
public record TabularInput(String fileName, InputStreamSource content) {}
