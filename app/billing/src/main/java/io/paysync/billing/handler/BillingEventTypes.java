package io.paysync.billing.handler;

/** Event type keys: provider webhook types plus the internally scheduled ones. */
public final class BillingEventTypes {

  public static final String SUBSCRIPTION_CREATED = "customer.subscription.created";
  public static final String SUBSCRIPTION_UPDATED = "customer.subscription.updated";
  public static final String SUBSCRIPTION_DELETED = "customer.subscription.deleted";
  public static final String SUBSCRIPTION_PAUSED = "customer.subscription.paused";
  public static final String SUBSCRIPTION_RESUMED = "customer.subscription.resumed";
  public static final String INVOICE_PAID = "invoice.paid";
  public static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";
  public static final String CHARGE_REFUNDED = "charge.refunded";
  public static final String CHARGE_DISPUTE_CREATED = "charge.dispute.created";
  public static final String PAYMENT_INTENT_FAILED = "payment_intent.payment_failed";
  public static final String CUSTOMER_UPDATED = "customer.updated";

  public static final String SUBSCRIPTION_REMINDER = "subscription.reminder";
  public static final String SUBSCRIPTION_EXPIRE = "subscription.expire";

  private BillingEventTypes() {}
}
