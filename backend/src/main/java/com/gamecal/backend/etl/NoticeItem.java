package com.gamecal.backend.etl;

/** An announcement reduced to what version resolution needs. Times are ISO with offset. */
public record NoticeItem(Long annId, String title, String subtitle, String startIso, String endIso) {}
