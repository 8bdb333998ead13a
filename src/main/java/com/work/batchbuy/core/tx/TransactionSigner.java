package com.work.batchbuy.core.tx;

import com.work.batchbuy.core.model.Account;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * EIP-155 签名。相同输入得到相同输出。
 */
public class TransactionSigner {

    public SignedPayload sign(TransactionIntent intent, Account account) {
        requireNonNull(intent, "intent");
        requireNonNull(account, "account");
        RawTransaction raw = RawTransaction.createTransaction(
                intent.getNonce(),
                intent.getGasPrice(),
                intent.getGasLimit(),
                intent.getTo(),
                intent.getValue(),
                intent.getData()
        );
        byte[] signed = TransactionEncoder.signMessage(raw, intent.getChainId(), account.getCredentials());
        return new SignedPayload(intent, Numeric.toHexString(signed), Numeric.toHexString(Hash.sha3(signed)));
    }
}
