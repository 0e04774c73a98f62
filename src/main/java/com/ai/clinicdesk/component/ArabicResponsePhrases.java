package com.ai.clinicdesk.component;

import com.ai.clinicdesk.conversation.InfoTopic;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Arabic reply templates in a plain Najdi register. Day and month names are spelled out here
 * rather than taken from locale data so the output never depends on the JDK's locale tables.
 */
public class ArabicResponsePhrases extends ResponsePhrases {

    private static final String[] DAYS = {
            "الاثنين", "الثلاثاء", "الأربعاء", "الخميس", "الجمعة", "السبت", "الأحد"};
    private static final String[] MONTHS = {
            "يناير", "فبراير", "مارس", "أبريل", "مايو", "يونيو",
            "يوليو", "أغسطس", "سبتمبر", "أكتوبر", "نوفمبر", "ديسمبر"};

    // ---- units ----

    @Override
    public String date(LocalDate date) {
        return DAYS[date.getDayOfWeek().getValue() - 1] + " " + date.getDayOfMonth() + " "
                + MONTHS[date.getMonthValue() - 1] + " " + date.getYear();
    }

    @Override
    public String dayShort(DayOfWeek day) {
        return DAYS[day.getValue() - 1];
    }

    @Override
    public String listSeparator() {
        return "، ";
    }

    @Override
    public String hoursRange(String from, String to) {
        return " من " + from + " إلى " + to;
    }

    @Override
    public String atPlace(String place) {
        return " في " + place;
    }

    @Override
    public String price(String amount) {
        return amount + " ريال";
    }

    @Override
    public String topicLabel(InfoTopic topic) {
        switch (topic) {
            case DOCTOR:
                return "الدكاترة";
            case SERVICE:
                return "الخدمات والأسعار";
            case BRANCH:
                return "الفروع والمواقع";
            case HOURS:
                return "أوقات الدوام";
            case CONTACT:
            default:
                return "طرق التواصل";
        }
    }

    // ---- greetings ----

    @Override
    public String greeting() {
        return "هلا والله! كيف أقدر أخدمك؟ تقدر تسأل عن الدكاترة والخدمات والأسعار والفروع، أو تحجز موعد.";
    }

    @Override
    public String thanks() {
        return "العفو! تبي شي ثاني؟";
    }

    @Override
    public String goodbye() {
        return "في أمان الله! راسلنا أي وقت.";
    }

    // ---- direct answers ----

    @Override
    public String doctorProfile(String name, String specialty, String branch, String schedule, Integer experienceYears) {
        StringBuilder sb = new StringBuilder(name);
        if (specialty != null) sb.append(" أخصائي ").append(specialty);
        if (branch != null) sb.append(" في ").append(branch);
        sb.append(".");
        if (experienceYears != null) sb.append(" خبرة ").append(experienceYears).append(" سنة.");
        if (schedule != null) sb.append(" الدوام المعتاد: ").append(schedule).append(".");
        return sb.toString();
    }

    @Override
    public String doctorListHeader(String branch) {
        return branch == null ? "دكاترتنا:" : "دكاترتنا في " + branch + ":";
    }

    @Override
    public String noDoctors() {
        return "ما عندي دكاترة مسجلين هناك حالياً.";
    }

    @Override
    public String serviceDetail(String name, String price, Integer durationMinutes, String preparation) {
        StringBuilder sb = new StringBuilder(name).append(": ").append(price).append(".");
        if (durationMinutes != null) sb.append(" تاخذ تقريباً ").append(durationMinutes).append(" دقيقة.");
        if (preparation != null) sb.append(" التحضير: ").append(preparation).append(".");
        return sb.toString();
    }

    @Override
    public String serviceListHeader() {
        return "خدماتنا:";
    }

    @Override
    public String priceOnRequest() {
        return "السعر عند الطلب";
    }

    @Override
    public String branchInfo(String name, String address, String phone, String hours) {
        StringBuilder sb = new StringBuilder(name);
        if (address != null) sb.append(": ").append(address);
        sb.append(".");
        if (hours != null) sb.append(" الدوام: ").append(hours).append(".");
        if (phone != null) sb.append(" الهاتف: ").append(phone).append(".");
        return sb.toString();
    }

    @Override
    public String branchListHeader() {
        return "فروعنا:";
    }

    @Override
    public String branchHours(String name, String weekdays, String weekend) {
        StringBuilder sb = new StringBuilder("دوام ").append(name).append(": ");
        sb.append("أيام الأسبوع ").append(weekdays != null ? weekdays : "غير محدد");
        sb.append("، نهاية الأسبوع ").append(weekend != null ? weekend : "مغلق").append(".");
        return sb.toString();
    }

    @Override
    public String contact(String name, String phone, String email) {
        StringBuilder sb = new StringBuilder("تقدر تتواصل مع ").append(name);
        if (phone != null) sb.append(" على ").append(phone);
        if (email != null) sb.append(phone != null ? " أو " : " على ").append(email);
        return sb.append(".").toString();
    }

    @Override
    public String availableOn(String doctor, String date) {
        return "إيه، " + doctor + " موجود يوم " + date + ".";
    }

    @Override
    public String notAvailableOn(String doctor, String date) {
        return "لا، " + doctor + " مو موجود يوم " + date + ".";
    }

    @Override
    public String availabilityNote(String note) {
        return " ملاحظة: " + note;
    }

    @Override
    public String noConfirmedAvailability(String doctor, String date, String schedule) {
        String base = "ما عندي تأكيد لتواجد " + doctor + " يوم " + date + ".";
        return schedule == null ? base : base + " دوامه المعتاد: " + schedule + ".";
    }

    // ---- clarification ----

    @Override
    public String whichDoctor() {
        return "أي دكتور تقصد؟ رد بالرقم:";
    }

    @Override
    public String whichService() {
        return "أي خدمة تقصد؟ رد بالرقم:";
    }

    @Override
    public String whichBranch() {
        return "أي فرع تقصد؟ رد بالرقم:";
    }

    @Override
    public String whichDate() {
        return "أي يوم تقصد؟ (مثلاً 'بكرا' أو 'الأحد' أو '25/10')";
    }

    @Override
    public String whichTopic() {
        return "وش تبي تعرف؟ رد بالرقم:";
    }

    @Override
    public String couldYouRephrase() {
        return "ممكن توضح لي أكثر وش تحتاج؟";
    }

    // ---- booking ----

    @Override
    public String bookingStarted() {
        return "أبشر، خلنا نحجز موعدك.";
    }

    @Override
    public String askName() {
        return "ما اسمك؟";
    }

    @Override
    public String askPhone() {
        return "ما رقم جوالك؟ (مثلاً 05XXXXXXXX)";
    }

    @Override
    public String askService() {
        return "أي خدمة تبي تحجز؟ رد بالرقم أو الاسم:";
    }

    @Override
    public String askBranch() {
        return "أي فرع تفضل؟ رد بالرقم، أو اكتب 'تخطى' للتخطي:";
    }

    @Override
    public String askDateTime() {
        return "متى تبي الموعد؟ (مثلاً 'بكرا 10 ص' أو '25/10/2026')، أو اكتب 'تخطى' للتخطي.";
    }

    @Override
    public String invalidName() {
        return "المعذرة، ما فهمت الاسم.";
    }

    @Override
    public String invalidPhone() {
        return "الرقم هذا ما يبدو رقم جوال سعودي صحيح.";
    }

    @Override
    public String invalidChoice() {
        return "المعذرة، ما قدرت أطابقه مع الخيارات.";
    }

    @Override
    public String invalidDate() {
        return "المعذرة، أحتاج تاريخ من اليوم وطالع.";
    }

    @Override
    public String confirmCandidates() {
        return "تقصد واحد من هذول؟ رد بالرقم:";
    }

    @Override
    public String bookingCompleted(String code) {
        return "✅ تم استلام طلبك وبنرجع لك نأكد الموعد. رقم الطلب: " + code + ".";
    }

    @Override
    public String bookingSummary(String name, String phone, String service, String branch, String when) {
        return "الاسم: " + name + "\nالجوال: " + phone + "\nالخدمة: " + service
                + "\nالفرع: " + (branch != null ? branch : "أي فرع")
                + "\nالوقت المفضل: " + (when != null ? when : "أي وقت");
    }

    @Override
    public String bookingCancelled() {
        return "ما عليه، ألغيت الحجز. اكتب 'حجز' أي وقت عشان تبدأ من جديد.";
    }

    @Override
    public String bookingAbandoned() {
        return "ما قدرت آخذ المعلومة بعد كم محاولة، فوقفت الحجز. اكتب 'حجز' أي وقت عشان تبدأ من جديد.";
    }

    @Override
    public String continueBooking() {
        return "نرجع لحجزك:";
    }

    // ---- failures ----

    @Override
    public String throttleNotice() {
        return "ترسل رسايل بسرعة شوي. انتظر دقيقة وجرب مرة ثانية.";
    }

    @Override
    public String apology() {
        return "المعذرة، صار خلل عندنا. جرب مرة ثانية بعد شوي.";
    }

    @Override
    public String fallback() {
        return "المعذرة، ما قدرت أجاوب على هذا الحين. تقدر تسأل عن الدكاترة والخدمات والأسعار والفروع، أو اكتب 'حجز' عشان تحجز موعد.";
    }
}
