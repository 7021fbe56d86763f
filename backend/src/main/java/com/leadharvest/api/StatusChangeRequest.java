package com.leadharvest.api;

public record StatusChangeRequest(String status) {
}
