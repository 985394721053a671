package com.questrail.lsnp.model;

/**
 * Wire field names.
 */
public final class LsnpFields
{
    private LsnpFields() {}

    public static final String TYPE = "TYPE";
    public static final String MESSAGE_ID = "MESSAGE_ID";
    public static final String TIMESTAMP = "TIMESTAMP";
    public static final String USER_ID = "USER_ID";
    public static final String FROM = "FROM";
    public static final String TO = "TO";
    public static final String TOKEN = "TOKEN";

    public static final String CONTENT = "CONTENT";
    public static final String TTL = "TTL";

    public static final String DISPLAY_NAME = "DISPLAY_NAME";
    public static final String STATUS = "STATUS";
    public static final String AVATAR_TYPE = "AVATAR_TYPE";
    public static final String AVATAR_ENCODING = "AVATAR_ENCODING";
    public static final String AVATAR_DATA = "AVATAR_DATA";

    public static final String PORT = "PORT";
    public static final String PEERS = "PEERS";
    public static final String COUNT = "COUNT";

    public static final String GROUP_ID = "GROUP_ID";
    public static final String GROUP_NAME = "GROUP_NAME";
    public static final String MEMBERS = "MEMBERS";
    public static final String ADD = "ADD";
    public static final String REMOVE = "REMOVE";

    public static final String POST_ID = "POST_ID";

    public static final String GAME_ID = "GAMEID";
    public static final String SYMBOL = "SYMBOL";
    public static final String POSITION = "POSITION";
    public static final String TURN = "TURN";
    public static final String RESULT = "RESULT";
    public static final String WINNING_LINE = "WINNING_LINE";
}
