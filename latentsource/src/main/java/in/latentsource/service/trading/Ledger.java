package in.latentsource.service.trading;

/**
 * Mutable position and cash for a single simulation run.
 *
 * Not thread-safe; each run creates its own ledger and drops it when done.
 */
final class Ledger {

    private long position;
    private double balance;
    private int trades;

    void buy(double price) {
        position++;
        balance -= price;
        trades++;
    }

    void sell(double price) {
        position--;
        balance += price;
        trades++;
    }

    /**
     * Flatten a single-unit position at the final price. Not counted as a trade.
     */
    void closeOut(double finalPrice) {
        if (position == 1) {
            balance += finalPrice;
        } else if (position == -1) {
            balance -= finalPrice;
        }
        position = 0;
    }

    long position() {
        return position;
    }

    double balance() {
        return balance;
    }

    int trades() {
        return trades;
    }
}
