package db.poorly.catalog;

import db.poorly.error.DbException;

/**
 * Supported column data types. The keyword is the lowercase name used in the schema file.
 */
public enum DataType {
    INT("int"),
    FLOAT("float"),
    CHAR("char"),
    STRING("string"),
    SERIAL("serial"),
    EMAIL("email");

    private final String keyword;

    DataType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() { return keyword; }

    public static DataType fromKeyword(String keyword) {
        for (DataType t : values()) {
            if (t.keyword.equals(keyword)) return t;
        }
        throw DbException.invalidDataType(keyword);
    }
}
