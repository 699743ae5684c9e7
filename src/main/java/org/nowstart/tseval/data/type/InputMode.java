package org.nowstart.tseval.data.type;

public enum InputMode {
    ARRAY,
    FILE_PATH
}
