package com.leadharvest.scrape.model;

public enum RenderMode {
    STATIC,
    BROWSER
}
