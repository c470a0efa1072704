package com.barte.sdk.request;

/** Filters for {@code GET /buyers}. */
public final class BuyerFilter extends ListFilter<BuyerFilter> {

    public static BuyerFilter create() {
        return new BuyerFilter();
    }

    public BuyerFilter document(String document) {
        return param("document", document);
    }

    public BuyerFilter name(String name) {
        return param("name", name);
    }

    public BuyerFilter email(String email) {
        return param("email", email);
    }

    @Override
    protected BuyerFilter self() {
        return this;
    }
}
