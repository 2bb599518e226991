package com.example.kb.service.parser;

import java.util.Locale;

public final class FileTypes {

    private FileTypes() {
    }

    /**
     * 取小写扩展名, 无扩展名时返回空串
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
