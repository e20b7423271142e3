package com.flagship.ledger_query.query;

import lombok.Value;

@Value
public class VirtualCardReference {
    String id;
}
