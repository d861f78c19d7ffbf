package com.ledgersync.normalize;

import org.springframework.stereotype.Component;

@Component
public class LineItemNormalizer implements RawRecord.Visitor<NormalizedLineItem> {
  private final StripeNormalizer stripeNormalizer;
  private final VenmoNormalizer venmoNormalizer;
  private final SplitwiseNormalizer splitwiseNormalizer;
  private final CashNormalizer cashNormalizer;

  public LineItemNormalizer(StripeNormalizer stripeNormalizer,
                            VenmoNormalizer venmoNormalizer,
                            SplitwiseNormalizer splitwiseNormalizer,
                            CashNormalizer cashNormalizer) {
    this.stripeNormalizer = stripeNormalizer;
    this.venmoNormalizer = venmoNormalizer;
    this.splitwiseNormalizer = splitwiseNormalizer;
    this.cashNormalizer = cashNormalizer;
  }

  public NormalizedLineItem normalize(RawRecord record) {
    return record.accept(this);
  }

  public String counterparty(RawRecord record) {
    return record.accept(new RawRecord.Visitor<>() {
      @Override
      public String visitStripe(StripeRecord stripe) {
        return stripe.description();
      }

      @Override
      public String visitVenmo(VenmoRecord venmo) {
        return venmoNormalizer.counterparty(venmo);
      }

      @Override
      public String visitSplitwise(SplitwiseRecord splitwise) {
        return splitwiseNormalizer.responsibleParty(splitwise);
      }

      @Override
      public String visitCash(CashRecord cash) {
        return cash.person();
      }
    });
  }

  @Override
  public NormalizedLineItem visitStripe(StripeRecord record) {
    return stripeNormalizer.normalize(record);
  }

  @Override
  public NormalizedLineItem visitVenmo(VenmoRecord record) {
    return venmoNormalizer.normalize(record);
  }

  @Override
  public NormalizedLineItem visitSplitwise(SplitwiseRecord record) {
    return splitwiseNormalizer.normalize(record);
  }

  @Override
  public NormalizedLineItem visitCash(CashRecord record) {
    return cashNormalizer.normalize(record);
  }
}
