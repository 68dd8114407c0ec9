package com.trade.paper;

import com.trade.paper.book.OrderBook;
import com.trade.paper.book.OrderBookListener;
import com.trade.paper.book.OrderBookSynchronizer;
import com.trade.paper.core.ConfigManager;
import com.trade.paper.core.Symbol;
import com.trade.paper.exchange.BinanceMarketDataSource;
import com.trade.paper.exchange.MarketDataSource;
import com.trade.paper.execution.LedgerListener;
import com.trade.paper.execution.MarketPriceBook;
import com.trade.paper.execution.Position;
import com.trade.paper.execution.PriceTriggerMonitor;
import com.trade.paper.execution.Trade;
import com.trade.paper.execution.TradingLedger;
import com.trade.paper.market.ConnectionListener;
import com.trade.paper.market.ConnectionStatus;
import com.trade.paper.market.StreamConfig;
import com.trade.paper.market.StreamConnectionManager;
import com.trade.paper.risk.RiskConfig;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 模拟合约交易主类
 * 连接实时行情，维护本地盘口，并用模拟账本撮合本地订单
 */
public class PaperTradingMain {

    private static final Logger logger = LoggerFactory.getLogger(PaperTradingMain.class);

    public static void main(String[] args) {
        System.out.println("""
            ================================================
               模拟合约交易 v1.0
               实时行情 · 本地盘口 · 模拟账本
            ================================================
            """);

        try {
            run(args);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("主线程被中断，退出");
        } catch (Exception e) {
            System.err.println("启动失败: " + e.getMessage());
            logger.error("启动失败", e);
        }
    }

    private static void run(String[] args) throws InterruptedException {
        ConfigManager config = ConfigManager.load();
        List<Symbol> symbols = parseSymbols(args.length > 0 ? args[0] : config.getProperty("app.symbols", "BTCUSDT"));

        // 行情连接
        OkHttpClient wsClient = new OkHttpClient.Builder()
                .pingInterval(3, TimeUnit.MINUTES)
                .build();
        StreamConfig streamConfig = StreamConfig.from(config);
        StreamConnectionManager connection = new StreamConnectionManager(wsClient, streamConfig);
        connection.addListener(new ConnectionListener() {
            @Override
            public void onStatusChange(ConnectionStatus status) {
                System.out.println("行情连接状态: " + status);
            }
        });

        // 盘口同步
        MarketDataSource dataSource = BinanceMarketDataSource.create(config);
        ExecutorService resyncExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "orderbook-resync");
            t.setDaemon(true);
            return t;
        });
        OrderBookSynchronizer synchronizer = new OrderBookSynchronizer(dataSource,
                config.getIntProperty("orderbook.snapshot.limit", 1000),
                config.getIntProperty("orderbook.buffer.max-size", 1000),
                resyncExecutor, streamConfig::newBackoff, System::currentTimeMillis);
        synchronizer.addListener(new OrderBookListener() {
            @Override
            public void onSnapshotLoaded(Symbol symbol, OrderBook book, boolean synced) {
                System.out.printf("%s 盘口已同步: 买一 %s, 卖一 %s%n", symbol,
                        book.getBestBid().map(l -> l.price().toPlainString()).orElse("-"),
                        book.getBestAsk().map(l -> l.price().toPlainString()).orElse("-"));
            }
        });

        // 模拟账本
        MarketPriceBook priceBook = new MarketPriceBook(synchronizer);
        TradingLedger ledger = new TradingLedger(RiskConfig.from(config), priceBook);
        ledger.addListener(new LedgerListener() {
            @Override
            public void onPositionClosed(Position position) {
                System.out.printf("平仓 %s %s, 已实现盈亏 %s%n", position.getSymbol(), position.getSide(),
                        position.getRealizedPnl().toPlainString());
            }

            @Override
            public void onLiquidation(Position position, Trade trade) {
                System.out.printf("强平 %s @ %s%n", position.getSymbol(), trade.getPrice().toPlainString());
            }
        });
        PriceTriggerMonitor triggerMonitor = new PriceTriggerMonitor(ledger);
        priceBook.addPriceListener(triggerMonitor);
        triggerMonitor.start();

        for (Symbol symbol : symbols) {
            priceBook.track(connection, symbol);
            synchronizer.track(connection, symbol, streamConfig.getDepthSpeed());
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("正在关闭...");
            triggerMonitor.stop();
            symbols.forEach(synchronizer::untrack);
            connection.shutdown();
            resyncExecutor.shutdownNow();
            System.out.println("账户: " + ledger.getWallet());
        }, "shutdown"));

        System.out.println("模拟交易已启动，交易对: " + symbols + "，按 Ctrl+C 退出...");

        // 保持运行
        Thread.currentThread().join();
    }

    private static List<Symbol> parseSymbols(String value) {
        List<Symbol> symbols = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                symbols.add(Symbol.of(part));
            }
        }
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个交易对");
        }
        return symbols;
    }
}
