package com.hubzone.designations.importer.http;

@FunctionalInterface
public interface PayloadValidator {
    PayloadValidator ACCEPT_ALL = body -> null;

    String validate(byte[] body);
}
