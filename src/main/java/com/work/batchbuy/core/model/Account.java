package com.work.batchbuy.core.model;

import org.web3j.crypto.Credentials;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonEmpty;

/**
 * 私钥 + 派生地址。整个运行期间只归属一个 worker，不落盘。
 */
public final class Account {

    private final Credentials credentials;

    private Account(Credentials credentials) {
        this.credentials = credentials;
    }

    public static Account fromPrivateKey(String privateKey) {
        requireNonEmpty(privateKey, "privateKey");
        String key = privateKey.trim();
        if (!key.startsWith("0x") && !key.startsWith("0X")) {
            key = "0x" + key;
        }
        return new Account(Credentials.create(key));
    }

    public String getAddress() {
        return credentials.getAddress();
    }

    public Credentials getCredentials() {
        return credentials;
    }

    @Override
    public String toString() {
        return "Account{address='" + getAddress() + "'}";
    }
}
