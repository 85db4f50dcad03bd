package com.dcruver.themerank.nlp;

import java.util.List;

/**
 * Names a cluster from its member texts.
 */
public interface ThemeLabeler {

    String label(List<String> memberTexts);
}
