package com.csv2bufr.exception;

/**
 * The mapping document does not conform to the mapping schema. Fatal for the whole transform.
 */
public class MappingSchemaException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final String elementKey;
    private final String path;

    public MappingSchemaException(String elementKey, String path, String message) {
        super(format(elementKey, path, message));
        this.elementKey = elementKey;
        this.path = path;
    }

    /**
     * Key of the sequence element that failed, or {@code null} when the document root is invalid.
     */
    public String getElementKey() {
        return elementKey;
    }

    public String getPath() {
        return path;
    }

    private static String format(String elementKey, String path, String message) {
        if (elementKey == null) {
            return "invalid mapping document (" + path + "): " + message;
        }
        return "invalid element (" + path + ") for " + elementKey + " in mapping file: " + message;
    }
}
