package me.internalizable.cricketscore.dto;

public record HitRequest(String rollNumber, String name, long shot) {

    public static final HitRequest EMPTY = new HitRequest(null, null, 0);
}
