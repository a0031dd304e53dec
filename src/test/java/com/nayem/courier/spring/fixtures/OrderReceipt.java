package com.nayem.courier.spring.fixtures;

public record OrderReceipt(String sku, int quantity) {
}
